package sp.sistemaspalacios.api_hermes.dto.autocheckout;

import lombok.Data;

import java.util.List;

@Data
public class AutoCheckoutRequest {
    /** Vacío: todos los empleados con dispositivo registrado. */
    private List<String> employees;
}

package sp.sistemaspalacios.api_hermes.dto.push;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class SubscribeRequest {

    @NotNull(message = "Missing subscription")
    @Valid
    private Subscription subscription;

    @Data
    public static class Subscription {
        @NotBlank(message = "Missing subscription endpoint")
        private String endpoint;
        private Keys keys;
    }

    @Data
    public static class Keys {
        private String p256dh;
        private String auth;
    }
}

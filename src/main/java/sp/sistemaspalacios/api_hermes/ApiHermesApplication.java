package sp.sistemaspalacios.api_hermes;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ApiHermesApplication {

    public static void main(String[] args) {
        SpringApplication.run(ApiHermesApplication.class, args);
    }
}

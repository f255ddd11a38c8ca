package it.der;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DER {

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(DER.class);
        app.setBanner((environment, sourceClass, out) -> { out.println("=== DER CODEC ==="); });
        app.setWebApplicationType(WebApplicationType.NONE);
        System.exit(SpringApplication.exit(app.run(args)));
    }
}

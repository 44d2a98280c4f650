package tech.noetzold.guardrail_api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GuardrailApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(GuardrailApiApplication.class, args);
    }
}

package it.aw.normativerag;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NormativeRagApplication {

    public static void main(String[] args) {
        SpringApplication.run(NormativeRagApplication.class, args);
    }
}

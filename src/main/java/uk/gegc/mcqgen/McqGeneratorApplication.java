package uk.gegc.mcqgen;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class McqGeneratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(McqGeneratorApplication.class, args);
    }
}

package uk.gegc.edgeprompt;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EdgePromptApplication {

    public static void main(String[] args) {
        SpringApplication.run(EdgePromptApplication.class, args);
    }
}

package eu.virtualparadox.ewexport;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EwExportApplication {

    public static void main(final String[] args) {
        SpringApplication.run(EwExportApplication.class, args);
    }
}

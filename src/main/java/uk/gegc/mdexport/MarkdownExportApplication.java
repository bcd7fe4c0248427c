package uk.gegc.mdexport;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MarkdownExportApplication {

    public static void main(String[] args) {
        SpringApplication.run(MarkdownExportApplication.class, args);
    }
}

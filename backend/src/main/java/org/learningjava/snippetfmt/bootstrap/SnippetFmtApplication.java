package org.learningjava.snippetfmt.bootstrap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "org.learningjava.snippetfmt")
public class SnippetFmtApplication {
    public static void main(String[] args) {
        SpringApplication.run(SnippetFmtApplication.class, args);
    }
}

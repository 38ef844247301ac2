package org.learningjava.snippetfmt.config;

import org.learningjava.snippetfmt.application.port.SyntaxParserPort;
import org.learningjava.snippetfmt.infrastructure.adapter.out.pythonParser.PythonSyntaxParserAdapter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AppConfig {

    //the only collaborator behind a port: the Python parser
    @Bean
    SyntaxParserPort syntaxParser() {
        return new PythonSyntaxParserAdapter();
    }

}

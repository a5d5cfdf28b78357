package com.example.templatefiller;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

@Slf4j
@SpringBootApplication
public class TemplateFillerApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext ctx = SpringApplication.run(TemplateFillerApplication.class, args);
        log.info("Template filler started on port {}", ctx.getEnvironment().getProperty("server.port", "8080"));
    }
}

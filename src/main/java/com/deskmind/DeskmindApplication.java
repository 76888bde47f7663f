package com.deskmind;

import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ApplicationContext;

@SpringBootApplication
public class DeskmindApplication {

    public static void main(String[] args) {
        ApplicationContext ctx = new SpringApplicationBuilder(DeskmindApplication.class)
                .properties(
                        "spring.main.web-application-type=none",
                        "spring.main.banner-mode=off"
                )
                .run(args);

        // CLI app: exit after command execution
        ExitCodeGenerator exitCodeGen = ctx.getBean(ExitCodeGenerator.class);
        int exitCode = SpringApplication.exit(ctx, exitCodeGen);
        System.exit(exitCode);
    }
}

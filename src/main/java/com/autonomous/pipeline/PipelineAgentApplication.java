package com.autonomous.pipeline;

import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ApplicationContext;

@SpringBootApplication
public class PipelineAgentApplication {

    public static void main(String[] args) {
        ApplicationContext ctx = SpringApplication.run(PipelineAgentApplication.class, args);
        // CLI app: exit once the command has run
        int exitCode = SpringApplication.exit(ctx, ctx.getBean(ExitCodeGenerator.class));
        System.exit(exitCode);
    }
}

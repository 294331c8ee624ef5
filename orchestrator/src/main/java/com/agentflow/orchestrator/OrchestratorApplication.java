package com.agentflow.orchestrator;

import com.agentflow.orchestrator.cli.WorkflowCommandRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication
public class OrchestratorApplication {

    /**
     * With a positional argument the app runs as a CLI (scan / apply /
     * apply-all) without a web server and exits with the command's exit
     * code, 2 for an unknown command. Otherwise it serves the HTTP API.
     *
     * To run:
     *   mvn spring-boot:run -Dspring-boot.run.arguments="apply --workflow=smoke --path=."
     */
    public static void main(String[] args) {
        if (WorkflowCommandRunner.isCommand(args)) {
            ConfigurableApplicationContext ctx = new SpringApplicationBuilder(OrchestratorApplication.class)
                    .web(WebApplicationType.NONE)
                    .run(args);
            System.exit(SpringApplication.exit(ctx));
        }
        SpringApplication.run(OrchestratorApplication.class, args);
    }
}

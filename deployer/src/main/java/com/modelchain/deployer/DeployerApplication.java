package com.modelchain.deployer;

import com.modelchain.deployer.chain.DeployedModels;
import com.modelchain.deployer.schema.ContractJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

@SpringBootApplication
public class DeployerApplication {

    private static final Logger log = LoggerFactory.getLogger(DeployerApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(DeployerApplication.class, args);
    }

    /**
     * Prints what a transport would publish for each deployed model: identity,
     * description and the request/response schemas of the outermost layer.
     *
     * Runs once the chains are built, so what it prints is exactly what
     * clients will see.
     */
    @Bean
    CommandLineRunner describeDeployments(DeployedModels deployedModels, ContractJson contractJson) {
        return args -> deployedModels.all().forEach((name, model) -> {
            log.info("=== {} ({} v{}) ===", model.displayName(), name, model.version());
            log.info("{}", model.description());
            log.info("input:  {}", contractJson.toJsonSchema(model.inputContract()));
            log.info("output: {}", contractJson.toJsonSchema(model.outputContract()));
        });
    }
}

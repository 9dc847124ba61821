package com.quantops.examples.worker;

import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;

/**
 * Standalone worker process running one simulated operation kind.
 *
 * <pre>
 * java -jar quantops-examples.jar --quantops.worker.kind=backtesting \
 *     --quantops.worker.public-endpoint=http://backtest-1:5004 --server.port=5004
 * </pre>
 */
@SpringBootApplication(scanBasePackages = {
    "com.quantops.examples.worker",
    "com.quantops.worker.web"
})
public class SimulatedWorkerApplication {

    public static void main(String[] args) {
        new SpringApplicationBuilder(SimulatedWorkerApplication.class)
            .properties("spring.config.name=worker")
            .run(args);
    }
}

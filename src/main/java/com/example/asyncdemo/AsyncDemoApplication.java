package com.example.asyncdemo;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Async Demo Application
 *
 * Shows how one request can wait on two slow, independent operations at
 * once instead of one after the other:
 * 1. A simulated product lookup (~500ms)
 * 2. A real HTTP call to a public todo API
 *
 * The combined endpoint takes about as long as the slower of the two.
 *
 * @see com.example.asyncdemo.controller.AsyncDemoController
 * @see com.example.asyncdemo.service.CombinedRequestHandler
 */
@SpringBootApplication
public class AsyncDemoApplication {

    public static void main(String[] args) {
        System.out.println("""
            ╔════════════════════════════════════════════════════════════════╗
            ║                     ASYNC DEMO APPLICATION                     ║
            ╠════════════════════════════════════════════════════════════════╣
            ║  Two independent lookups, started together, joined once.       ║
            ║                                                                ║
            ║  Endpoints:                                                    ║
            ║  • GET /combined/{id}         - Product + todo, fetched in     ║
            ║                                 parallel                       ║
            ║  • GET /api/asyncdemo/combined/{id}                            ║
            ║                               - Same, legacy route             ║
            ║  Paths match case-insensitively.                               ║
            ║                                                                ║
            ║  Metrics:                                                      ║
            ║  • GET /actuator/metrics      - All metrics                    ║
            ║  • GET /actuator/prometheus   - Prometheus format              ║
            ╚════════════════════════════════════════════════════════════════╝
            """);

        SpringApplication.run(AsyncDemoApplication.class, args);
    }
}

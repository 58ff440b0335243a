package org.learningjava.uniagent.bootstrap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "org.learningjava.uniagent")
public class UniAgentApplication {
    public static void main(String[] args) {
        SpringApplication.run(UniAgentApplication.class, args);
    }
}

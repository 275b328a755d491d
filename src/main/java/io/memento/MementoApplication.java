package io.memento;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Memento: long-term memory engine for AI agents, with recall ranking, decay and consolidation.
 */
@SpringBootApplication
public class MementoApplication {

    public static void main(String[] args) {
        SpringApplication.run(MementoApplication.class, args);
    }
}

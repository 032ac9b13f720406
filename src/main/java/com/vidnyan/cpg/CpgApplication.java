package com.vidnyan.cpg;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * CPG - Code Property Graph analysis engine.
 *
 * Builds control-flow, data-flow and unified property graphs for analyzed modules
 * and serves pattern matching, queries and runtime correlation on top of them.
 */
@SpringBootApplication
public class CpgApplication {

    public static void main(String[] args) {
        SpringApplication.run(CpgApplication.class, args);
    }
}

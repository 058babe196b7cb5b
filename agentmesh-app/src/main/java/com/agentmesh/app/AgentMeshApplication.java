package com.agentmesh.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application entry point for AgentMesh.
 */
@SpringBootApplication
public class AgentMeshApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentMeshApplication.class, args);
    }
}

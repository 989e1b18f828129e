package com.codeops.notebook;

import com.codeops.notebook.config.JwtProperties;
import com.codeops.notebook.config.NotebookProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * CodeOps-Notebook application entry point. Folders, notes, sharing, drafts and autosave for the planner.
 */
@SpringBootApplication
@EnableConfigurationProperties({JwtProperties.class, NotebookProperties.class})
public class NotebookApplication {

    public static void main(String[] args) {
        SpringApplication.run(NotebookApplication.class, args);
    }
}

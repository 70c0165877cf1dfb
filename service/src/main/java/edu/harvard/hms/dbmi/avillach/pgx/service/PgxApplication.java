package edu.harvard.hms.dbmi.avillach.pgx.service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;

@SpringBootApplication
@ComponentScan("edu.harvard.hms.dbmi.avillach.pgx")
public class PgxApplication {

    public static void main(String[] args) {
        SpringApplication.run(PgxApplication.class, args);
    }

}

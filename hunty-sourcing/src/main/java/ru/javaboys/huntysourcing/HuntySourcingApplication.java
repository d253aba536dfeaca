package ru.javaboys.huntysourcing;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HuntySourcingApplication {

    public static void main(String[] args) {
        SpringApplication.run(HuntySourcingApplication.class, args);
    }
}

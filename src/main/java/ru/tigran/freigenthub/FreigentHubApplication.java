package ru.tigran.freigenthub;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FreigentHubApplication {

    public static void main(String[] args) {
        SpringApplication.run(FreigentHubApplication.class, args);
    }
}

package org.cspii.intranet;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HierarchySyncApplication {
    public static void main(String[] args) {
        SpringApplication.run(HierarchySyncApplication.class, args);
    }
}

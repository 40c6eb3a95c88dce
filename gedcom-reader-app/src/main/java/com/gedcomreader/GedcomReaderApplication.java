package com.gedcomreader;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GedcomReaderApplication {

    public static void main(String[] args) {
        SpringApplication.run(GedcomReaderApplication.class, args);
    }
}

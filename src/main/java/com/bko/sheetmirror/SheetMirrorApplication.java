package com.bko.sheetmirror;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SheetMirrorApplication {
    public static void main(String[] args) {
        SpringApplication.run(SheetMirrorApplication.class, args);
    }
}

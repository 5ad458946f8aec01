package com.musicgroups;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MusicGroupsApplication {

    public static void main(String[] args) {
        SpringApplication.run(MusicGroupsApplication.class, args);
    }
}

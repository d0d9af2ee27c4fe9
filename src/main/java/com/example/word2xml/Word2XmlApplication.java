package com.example.word2xml;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class Word2XmlApplication {

    public static void main(String[] args) {
        SpringApplication.run(Word2XmlApplication.class, args);
    }

}

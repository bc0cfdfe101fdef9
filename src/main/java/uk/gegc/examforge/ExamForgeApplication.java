package uk.gegc.examforge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ExamForgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(ExamForgeApplication.class, args);
    }
}

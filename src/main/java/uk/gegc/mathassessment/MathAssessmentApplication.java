package uk.gegc.mathassessment;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MathAssessmentApplication {

    public static void main(String[] args) {
        SpringApplication.run(MathAssessmentApplication.class, args);
    }
}

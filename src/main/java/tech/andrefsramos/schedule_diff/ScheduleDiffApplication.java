package tech.andrefsramos.schedule_diff;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ScheduleDiffApplication {

    public static void main(String[] args) {
        SpringApplication.run(ScheduleDiffApplication.class, args);
    }
}

package dev.newsjournal;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class NewsJournalApplication {

    public static void main(String[] args) {
        SpringApplication.run(NewsJournalApplication.class, args);
    }
}

package org.smileyface.scopedcrawler;

import org.smileyface.scopedcrawler.config.CrawlerProperties;
import org.smileyface.scopedcrawler.service.CrawlerService;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@SpringBootApplication
@EnableConfigurationProperties(CrawlerProperties.class)
public class ScopedCrawlerApplication {

	public static void main(String[] args) {
		SpringApplication.run(ScopedCrawlerApplication.class, args);
	}

	/**
	 * Crawls once at startup when {@code crawler.seed-url} is set.
	 */
	@Bean
	public ApplicationRunner crawlOnStartup(CrawlerProperties properties, CrawlerService crawlerService) {
		return args -> {
			String seed = properties.getSeedUrl();
			if (seed != null && !seed.isBlank()) {
				crawlerService.crawl(seed);
			}
		};
	}
}

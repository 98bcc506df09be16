package com.share_link_repair;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ShareLinkRepairApplication {

	public static void main(String[] args) {
		SpringApplication.run(ShareLinkRepairApplication.class, args);
	}
}

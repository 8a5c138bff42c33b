package com.sashkomusic.playlistbridge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SmPlaylistBridgeApplication {

	public static void main(String[] args) {
		SpringApplication.run(SmPlaylistBridgeApplication.class, args);
	}

}

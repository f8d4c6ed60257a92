package com.shop.stockkeeper;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ShopStockKeeperApplication {

	public static void main(String[] args) {
		SpringApplication.run(ShopStockKeeperApplication.class, args);
	}

}

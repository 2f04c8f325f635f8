package com.tailtracker.cache;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 自适应缓存引擎启动类
 */
@SpringBootApplication
public class AdaptiveCacheApplication {

    public static void main(String[] args) {
        SpringApplication.run(AdaptiveCacheApplication.class, args);
    }
}

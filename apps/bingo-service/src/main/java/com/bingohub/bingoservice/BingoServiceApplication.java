package com.bingohub.bingoservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * bingo-service 启动入口。
 * 叫号方权威服务：Redis 持久化叫号状态、Redis pub/sub 广播事件、STOMP 推送给浏览器玩家。
 */
@SpringBootApplication
public class BingoServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(BingoServiceApplication.class, args);
    }
}

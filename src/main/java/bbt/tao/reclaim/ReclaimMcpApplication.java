package bbt.tao.reclaim;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ReclaimMcpApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReclaimMcpApplication.class, args);
    }

}

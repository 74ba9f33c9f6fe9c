package com.jonathantong.WalShift;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * WalShift - Zero-loss PostgreSQL migration using a replication slot, a bulk copy and CDC
 *
 * 	- Replication slot created before pg_dump so no commit falls between copy and stream
 * 	- pg_dump / pg_restore bulk copy
 * 	- Debezium change capture into Kafka
 * 	- Idempotent upserts/deletes into the replica
 */
@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
public class WalShiftApplication {

	public static void main(String[] args) {
		SpringApplication.run(WalShiftApplication.class, args);
	}

}

package com.chuckbox.reconcile;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Chuckbox reconcile - merges authoritative checklist identifiers with scraped UI trees.
 */
@SpringBootApplication
public class ChuckboxReconcileApplication {

	public static void main(String[] args) {
		SpringApplication.run(ChuckboxReconcileApplication.class, args);
	}

}

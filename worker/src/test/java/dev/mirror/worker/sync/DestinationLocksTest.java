package dev.mirror.worker.sync;

import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DestinationLocksTest {

	private final DestinationLocks locks = new DestinationLocks();

	@Test
	void disjointRootsRunSideBySide() throws Exception {
		try (DestinationLocks.Lease a = this.locks.acquire(Path.of("/tmp/mirror-a"));
				DestinationLocks.Lease b = this.locks.acquire(Path.of("/tmp/mirror-b"))) {
			assertThat(this.locks.activeCount()).isEqualTo(2);
		}
		assertThat(this.locks.activeCount()).isZero();
	}

	@Test
	void nestedRootWaitsForEnclosingRun() throws Exception {
		DestinationLocks.Lease outer = this.locks.acquire(Path.of("/tmp/mirror"));
		CompletableFuture<DestinationLocks.Lease> inner = CompletableFuture.supplyAsync(() -> {
			try {
				return this.locks.acquire(Path.of("/tmp/mirror/sub"));
			}
			catch (InterruptedException ex) {
				throw new IllegalStateException(ex);
			}
		});

		Thread.sleep(100);
		assertThat(inner).isNotDone();

		outer.close();
		DestinationLocks.Lease acquired = inner.get(2, TimeUnit.SECONDS);
		assertThat(this.locks.activeCount()).isEqualTo(1);
		acquired.close();
	}

}

package works.schematic.compiler;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PipelineCacheTest {
	PipelineCache<String, Holder> cache;
	AtomicInteger builds;

	/**
	 * A stand-in pipeline: either a finished value, or a placeholder pointing at one.
	 */
	static final class Holder {
		final String value;
		final AtomicReference<Holder> target = new AtomicReference<>();

		Holder(String value) {
			this.value = value;
		}

		String resolve() {
			return (value != null) ? value : target.get().value;
		}
	}

	@BeforeEach
	void setup() {
		cache = new PipelineCache<>("test", key -> {
			Holder stub = new Holder(null);
			return new PipelineCache.ForwardReference<Holder>() {
				@Override
				public Holder placeholder() {
					return stub;
				}

				@Override
				public void bind(Holder target) {
					stub.target.set(target);
				}
			};
		});
		builds = new AtomicInteger();
	}

	@Test
	void get_buildsOnce() {
		Holder first = cache.get("a", this::build);
		assertThat(cache.get("a", this::build), sameInstance(first));
		assertEquals(1, builds.get());
		assertEquals(1, cache.size());
	}

	@Test
	void reentrantRequest_getsBoundForwardReference() {
		AtomicReference<Holder> inner = new AtomicReference<>();
		Holder outer = cache.get("self", key -> {
			inner.set(cache.get("self", this::build));
			return new Holder("done");
		});

		assertNull(inner.get().value);
		assertThat(inner.get().target.get(), sameInstance(outer));
		assertEquals("done", inner.get().resolve());
		assertEquals(0, builds.get());
	}

	@Test
	void failedBuild_cachesNothing() {
		assertThrows(IllegalStateException.class, () -> cache.get("bad", key -> {
			throw new IllegalStateException("boom");
		}));
		assertEquals(0, cache.size());
		assertEquals("bad", cache.get("bad", this::build).value);
	}

	@Test
	void clear_discardsEverything() {
		Holder first = cache.get("a", this::build);
		cache.clear();
		assertEquals(0, cache.size());
		assertEquals("a", cache.get("a", this::build).value);
		assertEquals(2, builds.get());
		assertThat(cache.get("a", this::build), not(sameInstance(first)));
	}

	private Holder build(String key) {
		builds.incrementAndGet();
		return new Holder(key);
	}
}

package works.schematic.compiler;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * Holds finished pipelines and serializes the building of new ones.
 * <p>
 * Lookups of finished pipelines don't lock.
 * Builds happen one at a time under a {@link ReentrantLock},
 * so a thread asking for a key that another thread is building
 * waits for it and then finds it cached.
 * <p>
 * A build may, through nested fields, ask for its own key again on the same thread.
 * Such a request is detected on the compilation stack and answered with a
 * forward reference, which is bound to the finished pipeline when the build completes.
 * A build that fails caches nothing, and its forward references are never bound.
 *
 * @param <K> identifies a pipeline
 * @param <P> the pipeline type
 */
public final class PipelineCache<K, P> {
	private final String description;
	private final Function<K, ForwardReference<P>> forwardReferences;
	private final Map<K, P> cache = new ConcurrentHashMap<>();
	private final ReentrantLock lock = new ReentrantLock();
	private final Deque<Frame<K, P>> compilationStack = new ArrayDeque<>();

	/**
	 * A placeholder handed to reentrant requesters.
	 */
	public interface ForwardReference<P> {
		P placeholder();

		void bind(P target);
	}

	private static final class Frame<K, P> {
		final K key;
		final List<ForwardReference<P>> pending = new ArrayList<>();

		Frame(K key) {
			this.key = key;
		}
	}

	public PipelineCache(String description, Function<K, ForwardReference<P>> forwardReferences) {
		this.description = requireNonNull(description);
		this.forwardReferences = requireNonNull(forwardReferences);
	}

	public P get(K key, Function<K, P> builder) {
		P existing = cache.get(requireNonNull(key));
		if (existing != null) {
			return existing;
		}
		lock.lock();
		try {
			existing = cache.get(key);
			if (existing != null) {
				return existing;
			}
			for (Frame<K, P> frame : compilationStack) {
				if (frame.key.equals(key)) {
					LOGGER.debug("{}: cycle detected at {}; using forward reference", description, key);
					ForwardReference<P> forward = forwardReferences.apply(key);
					frame.pending.add(forward);
					return forward.placeholder();
				}
			}

			Frame<K, P> frame = new Frame<>(key);
			compilationStack.push(frame);
			P result;
			try {
				LOGGER.debug("{}: building {} at depth {}", description, key, compilationStack.size());
				result = requireNonNull(builder.apply(key));
			} finally {
				Frame<K, P> popped = compilationStack.pop();
				assert popped == frame;
			}
			cache.put(key, result);
			frame.pending.forEach(f -> f.bind(result));
			return result;
		} finally {
			lock.unlock();
		}
	}

	public void clear() {
		lock.lock();
		try {
			assert compilationStack.isEmpty(): "Cannot clear " + description + " during compilation";
			cache.clear();
		} finally {
			lock.unlock();
		}
	}

	public int size() {
		return cache.size();
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(PipelineCache.class);
}

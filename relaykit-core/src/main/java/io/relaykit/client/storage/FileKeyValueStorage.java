/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.relaykit.client.storage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import io.relaykit.json.RelayJsonMapper;
import io.relaykit.json.TypeRef;
import io.relaykit.spec.KeyValueStorage;
import io.relaykit.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * {@link KeyValueStorage} backed by a single JSON document on disk, one member per key.
 * <p>
 * The document is loaded on first access and rewritten in full on every change, through
 * a temporary file that is then moved over the original. File I/O runs on
 * {@link Schedulers#boundedElastic()} unless another scheduler is given.
 */
public class FileKeyValueStorage implements KeyValueStorage {

	private static final Logger logger = LoggerFactory.getLogger(FileKeyValueStorage.class);

	private static final TypeRef<Map<String, Object>> DOCUMENT_TYPE = new TypeRef<>() {
	};

	private static final TypeRef<Object> TREE_TYPE = new TypeRef<>() {
	};

	private final Path file;

	private final RelayJsonMapper jsonMapper;

	private final Scheduler scheduler;

	private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

	// Guarded by lock; null until loaded
	private Map<String, Object> document;

	public FileKeyValueStorage(Path file) {
		this(file, RelayJsonMapper.createDefault(), Schedulers.boundedElastic());
	}

	public FileKeyValueStorage(Path file, RelayJsonMapper jsonMapper, Scheduler scheduler) {
		Assert.notNull(file, "file must not be null");
		Assert.notNull(jsonMapper, "jsonMapper must not be null");
		Assert.notNull(scheduler, "scheduler must not be null");
		this.file = file;
		this.jsonMapper = jsonMapper;
		this.scheduler = scheduler;
	}

	public Path file() {
		return this.file;
	}

	@Override
	public <T> Mono<T> getItem(String key, TypeRef<T> type) {
		return onScheduler(() -> {
			Object value = read(doc -> doc.get(key));
			return (value != null) ? this.jsonMapper.convertValue(value, type) : null;
		});
	}

	@Override
	public Mono<Void> setItem(String key, Object value) {
		return onScheduler(() -> {
			Object tree = this.jsonMapper.convertValue(value, TREE_TYPE);
			write(doc -> doc.put(key, tree));
			return null;
		}).then();
	}

	@Override
	public Mono<Void> removeItem(String key) {
		return onScheduler(() -> {
			write(doc -> doc.remove(key));
			return null;
		}).then();
	}

	@Override
	public Flux<String> getKeys() {
		return onScheduler(() -> read(doc -> List.copyOf(doc.keySet()))).flatMapIterable(keys -> keys);
	}

	private <T> Mono<T> onScheduler(Callable<T> callable) {
		return Mono.fromCallable(callable).subscribeOn(this.scheduler);
	}

	private <T> T read(DocumentFunction<T> reader) throws IOException {
		this.lock.readLock().lock();
		try {
			if (this.document != null) {
				return reader.apply(this.document);
			}
		}
		finally {
			this.lock.readLock().unlock();
		}
		this.lock.writeLock().lock();
		try {
			return reader.apply(loaded());
		}
		finally {
			this.lock.writeLock().unlock();
		}
	}

	private void write(DocumentFunction<?> writer) throws IOException {
		this.lock.writeLock().lock();
		try {
			Map<String, Object> doc = loaded();
			writer.apply(doc);
			flush(doc);
		}
		finally {
			this.lock.writeLock().unlock();
		}
	}

	// Callers hold the write lock
	private Map<String, Object> loaded() throws IOException {
		if (this.document == null) {
			if (Files.exists(this.file) && Files.size(this.file) > 0) {
				this.document = new LinkedHashMap<>(this.jsonMapper.readValue(Files.readAllBytes(this.file),
						DOCUMENT_TYPE));
				logger.debug("Loaded {} keys from {}", this.document.size(), this.file);
			}
			else {
				this.document = new LinkedHashMap<>();
			}
		}
		return this.document;
	}

	private void flush(Map<String, Object> doc) throws IOException {
		Path parent = this.file.toAbsolutePath().getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}
		Path tmp = this.file.resolveSibling(this.file.getFileName() + ".tmp");
		Files.write(tmp, this.jsonMapper.writeValueAsBytes(doc));
		Files.move(tmp, this.file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
		logger.trace("Wrote {} keys to {}", doc.size(), this.file);
	}

	@FunctionalInterface
	private interface DocumentFunction<T> {

		T apply(Map<String, Object> document) throws IOException;

	}

}

package com.example.statements.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import com.example.statements.domain.DispatchLock;
import com.example.statements.repository.DispatchLockRepository;

/**
 * Creates the coordination rows that enqueue serializes on. Schema is generated by Hibernate,
 * so the rows are seeded here rather than by a migration.
 */
@Component
public class DispatchLockInitializer implements ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(DispatchLockInitializer.class);

  private final DispatchLockRepository lockRepository;

  public DispatchLockInitializer(DispatchLockRepository lockRepository) {
    this.lockRepository = lockRepository;
  }

  @Override
  @Transactional
  public void run(ApplicationArguments args) {
    if (lockRepository.existsById(DispatchLock.ENQUEUE)) {
      log.debug("Dispatch lock row already exists: {}", DispatchLock.ENQUEUE);
      return;
    }
    lockRepository.save(new DispatchLock(DispatchLock.ENQUEUE));
    log.info("Created dispatch lock row: {}", DispatchLock.ENQUEUE);
  }
}

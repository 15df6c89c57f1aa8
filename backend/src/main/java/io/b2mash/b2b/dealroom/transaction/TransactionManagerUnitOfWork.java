package io.b2mash.b2b.dealroom.transaction;

import io.b2mash.b2b.dealroom.exception.ResourceConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.DefaultTransactionDefinition;

/**
 * {@link UnitOfWork} backed by Spring's {@link PlatformTransactionManager}. Spring Data
 * repositories bind to the same transaction through transaction synchronization, so every save
 * between {@link #begin()} and {@link #commit(Handle)} lands in one database transaction.
 */
@Component
public class TransactionManagerUnitOfWork implements UnitOfWork {

  private static final Logger log = LoggerFactory.getLogger(TransactionManagerUnitOfWork.class);

  private final PlatformTransactionManager transactionManager;

  public TransactionManagerUnitOfWork(PlatformTransactionManager transactionManager) {
    this.transactionManager = transactionManager;
  }

  @Override
  public Handle begin() {
    var definition = new DefaultTransactionDefinition(TransactionDefinition.PROPAGATION_REQUIRED);
    definition.setName("negotiation-unit-of-work");
    return new TransactionHandle(transactionManager.getTransaction(definition));
  }

  @Override
  public void commit(Handle handle) {
    var status = unwrap(handle);
    try {
      transactionManager.commit(status);
    } catch (DataAccessException | TransactionException e) {
      log.warn("Unit of work commit failed: {}", e.getMessage());
      throw new ResourceConflictException(
          "Transaction failure",
          "The operation could not be committed and was rolled back. Please retry.",
          e);
    }
  }

  @Override
  public void rollback(Handle handle) {
    var status = unwrap(handle);
    if (status.isCompleted()) {
      return;
    }
    transactionManager.rollback(status);
  }

  private static TransactionStatus unwrap(Handle handle) {
    if (!(handle instanceof TransactionHandle transactionHandle)) {
      throw new IllegalArgumentException("Handle was not issued by this unit of work");
    }
    return transactionHandle.status();
  }

  record TransactionHandle(TransactionStatus status) implements Handle {

    @Override
    public boolean isCompleted() {
      return status.isCompleted();
    }
  }
}

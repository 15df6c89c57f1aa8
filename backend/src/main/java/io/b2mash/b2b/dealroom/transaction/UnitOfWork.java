package io.b2mash.b2b.dealroom.transaction;

import java.util.function.Function;

/**
 * Explicit unit of work spanning every repository write of one negotiation action. Repositories
 * join the active unit of work; nothing is visible to other transactions until {@link
 * #commit(Handle)} succeeds.
 */
public interface UnitOfWork {

  /** Starts a unit of work, or joins the one already active on this thread. */
  Handle begin();

  /**
   * Commits the unit of work.
   *
   * @throws io.b2mash.b2b.dealroom.exception.ResourceConflictException if the commit fails for
   *     concurrency or storage reasons; nothing is persisted in that case
   */
  void commit(Handle handle);

  /** Rolls back the unit of work. A no-op if the handle has already completed. */
  void rollback(Handle handle);

  /**
   * Runs {@code work} inside a new unit of work, committing on normal return and rolling back on
   * any exception, which is rethrown unchanged.
   */
  default <T> T execute(Function<Handle, T> work) {
    Handle handle = begin();
    T result;
    try {
      result = work.apply(handle);
    } catch (RuntimeException | Error e) {
      rollback(handle);
      throw e;
    }
    commit(handle);
    return result;
  }

  /** Opaque handle of an in-flight unit of work. */
  interface Handle {

    /** True once the handle has been committed or rolled back. */
    boolean isCompleted();

    /** Throws {@link IllegalStateException} unless the handle is still open. */
    default void requireActive() {
      if (isCompleted()) {
        throw new IllegalStateException("Unit of work has already completed");
      }
    }
  }
}

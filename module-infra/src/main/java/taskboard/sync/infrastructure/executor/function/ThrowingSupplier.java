package taskboard.sync.infrastructure.executor.function;

/** checked 예외를 포함한 모든 Throwable을 던질 수 있는 Supplier */
@FunctionalInterface
public interface ThrowingSupplier<T> {
  T get() throws Throwable;
}

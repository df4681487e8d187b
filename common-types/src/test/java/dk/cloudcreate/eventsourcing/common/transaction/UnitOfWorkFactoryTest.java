package dk.cloudcreate.eventsourcing.common.transaction;

import org.junit.jupiter.api.*;

import java.io.IOException;
import java.util.*;

import static org.assertj.core.api.Assertions.*;

class UnitOfWorkFactoryTest {
    private RecordingUnitOfWorkFactory unitOfWorkFactory;

    @BeforeEach
    void setup() {
        unitOfWorkFactory = new RecordingUnitOfWorkFactory();
    }

    @Test
    void verify_a_new_unit_of_work_is_committed_when_the_function_returns() {
        // When
        var result = unitOfWorkFactory.withUnitOfWork(unitOfWork -> "done");

        // Then
        assertThat(result).isEqualTo("done");
        assertThat(unitOfWorkFactory.created).hasSize(1);
        assertThat(unitOfWorkFactory.created.get(0).status()).isEqualTo(UnitOfWorkStatus.Committed);
        assertThat(unitOfWorkFactory.getCurrentUnitOfWork()).isEmpty();
    }

    @Test
    void verify_a_new_unit_of_work_is_rolled_back_and_the_runtime_exception_rethrown() {
        // Given
        var failure = new IllegalStateException("Boom");

        // When
        assertThatThrownBy(() -> unitOfWorkFactory.usingUnitOfWork(unitOfWork -> {
            throw failure;
        })).isSameAs(failure);

        // Then
        var unitOfWork = unitOfWorkFactory.created.get(0);
        assertThat(unitOfWork.status()).isEqualTo(UnitOfWorkStatus.RolledBack);
        assertThat(unitOfWork.getCauseOfRollback()).isSameAs(failure);
    }

    @Test
    void verify_a_checked_exception_is_wrapped_in_a_UnitOfWorkException() {
        assertThatThrownBy(() -> unitOfWorkFactory.usingUnitOfWork(unitOfWork -> {
            throw new IOException("Disk full");
        })).isInstanceOf(UnitOfWorkException.class)
           .hasCauseInstanceOf(IOException.class);

        assertThat(unitOfWorkFactory.created.get(0).status()).isEqualTo(UnitOfWorkStatus.RolledBack);
    }

    @Test
    void verify_a_nested_unit_of_work_joins_the_outer_unit_of_work() {
        // When
        unitOfWorkFactory.usingUnitOfWork(outer -> {
            unitOfWorkFactory.usingUnitOfWork(inner -> assertThat(inner).isSameAs(outer));
            // The nested usage must not commit the outer unit of work
            assertThat(outer.status()).isEqualTo(UnitOfWorkStatus.Started);
        });

        // Then
        assertThat(unitOfWorkFactory.created).hasSize(1);
        assertThat(unitOfWorkFactory.created.get(0).status()).isEqualTo(UnitOfWorkStatus.Committed);
    }

    @Test
    void verify_a_failing_nested_unit_of_work_marks_the_outer_unit_of_work_as_rollback_only() {
        // When
        unitOfWorkFactory.usingUnitOfWork(outer -> {
            assertThatThrownBy(() -> unitOfWorkFactory.usingUnitOfWork(inner -> {
                throw new IllegalArgumentException("Invalid");
            })).isInstanceOf(IllegalArgumentException.class);
            assertThat(outer.status()).isEqualTo(UnitOfWorkStatus.MarkedForRollbackOnly);
        });

        // Then
        var unitOfWork = unitOfWorkFactory.created.get(0);
        assertThat(unitOfWork.status()).isEqualTo(UnitOfWorkStatus.RolledBack);
        assertThat(unitOfWork.getCauseOfRollback()).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void verify_getRequiredUnitOfWork_fails_without_an_active_unit_of_work() {
        assertThatThrownBy(() -> unitOfWorkFactory.getRequiredUnitOfWork())
                .isInstanceOf(NoActiveUnitOfWorkException.class);
    }

    private static class RecordingUnitOfWorkFactory implements UnitOfWorkFactory<RecordingUnitOfWork> {
        private final List<RecordingUnitOfWork> created = new ArrayList<>();
        private       RecordingUnitOfWork       current;

        @Override
        public RecordingUnitOfWork getRequiredUnitOfWork() {
            if (current == null) {
                throw new NoActiveUnitOfWorkException();
            }
            return current;
        }

        @Override
        public RecordingUnitOfWork getOrCreateNewUnitOfWork() {
            if (current == null) {
                current = new RecordingUnitOfWork(this);
                current.start();
                created.add(current);
            }
            return current;
        }

        @Override
        public Optional<RecordingUnitOfWork> getCurrentUnitOfWork() {
            return Optional.ofNullable(current);
        }
    }

    private static class RecordingUnitOfWork implements UnitOfWork {
        private final RecordingUnitOfWorkFactory factory;
        private       UnitOfWorkStatus           status = UnitOfWorkStatus.Ready;
        private       Exception                  causeOfRollback;

        RecordingUnitOfWork(RecordingUnitOfWorkFactory factory) {
            this.factory = factory;
        }

        @Override
        public void start() {
            status = UnitOfWorkStatus.Started;
        }

        @Override
        public void commit() {
            status = UnitOfWorkStatus.Committed;
            factory.current = null;
        }

        @Override
        public void rollback(Exception cause) {
            causeOfRollback = cause;
            status = UnitOfWorkStatus.RolledBack;
            factory.current = null;
        }

        @Override
        public UnitOfWorkStatus status() {
            return status;
        }

        @Override
        public Exception getCauseOfRollback() {
            return causeOfRollback;
        }

        @Override
        public void markAsRollbackOnly(Exception cause) {
            status = UnitOfWorkStatus.MarkedForRollbackOnly;
            causeOfRollback = cause;
        }
    }
}

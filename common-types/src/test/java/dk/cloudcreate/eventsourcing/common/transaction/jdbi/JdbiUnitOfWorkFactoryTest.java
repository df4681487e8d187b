package dk.cloudcreate.eventsourcing.common.transaction.jdbi;

import dk.cloudcreate.eventsourcing.common.transaction.UnitOfWorkException;
import org.jdbi.v3.core.Jdbi;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Proxy;
import java.sql.*;
import java.util.concurrent.atomic.*;

import static org.assertj.core.api.Assertions.*;

class JdbiUnitOfWorkFactoryTest {

    @Test
    void verify_a_failure_to_open_a_connection_leaves_no_unit_of_work_behind() {
        // Given
        var unitOfWorkFactory = new JdbiUnitOfWorkFactory(Jdbi.create(() -> {
            throw new SQLException("Connection refused");
        }));

        // When
        assertThatThrownBy(unitOfWorkFactory::getOrCreateNewUnitOfWork)
                .isInstanceOf(UnitOfWorkException.class)
                .hasMessageContaining("Failed to start UnitOfWork");

        // Then
        assertThat(unitOfWorkFactory.getCurrentUnitOfWork()).isEmpty();
    }

    @Test
    void verify_the_connection_is_closed_when_the_transaction_cannot_be_started() {
        // Given
        var connectionClosed = new AtomicBoolean();
        var opened           = new AtomicInteger();
        var unitOfWorkFactory = new JdbiUnitOfWorkFactory(Jdbi.create(() -> {
            opened.incrementAndGet();
            return connectionThatCannotBeginTransactions(connectionClosed);
        }));

        // When
        assertThatThrownBy(unitOfWorkFactory::getOrCreateNewUnitOfWork)
                .isInstanceOf(UnitOfWorkException.class);

        // Then
        assertThat(opened).hasValue(1);
        assertThat(connectionClosed).isTrue();
        assertThat(unitOfWorkFactory.getCurrentUnitOfWork()).isEmpty();
    }

    private static Connection connectionThatCannotBeginTransactions(AtomicBoolean connectionClosed) {
        return (Connection) Proxy.newProxyInstance(JdbiUnitOfWorkFactoryTest.class.getClassLoader(),
                                                   new Class<?>[]{Connection.class},
                                                   (proxy, method, args) -> {
                                                       switch (method.getName()) {
                                                           case "setAutoCommit":
                                                               if (Boolean.FALSE.equals(args[0])) {
                                                                   throw new SQLException("Transactions are not supported");
                                                               }
                                                               return null;
                                                           case "getAutoCommit":
                                                               return true;
                                                           case "close":
                                                               connectionClosed.set(true);
                                                               return null;
                                                           case "isClosed":
                                                               return connectionClosed.get();
                                                           case "isWrapperFor":
                                                               return false;
                                                           case "hashCode":
                                                               return System.identityHashCode(proxy);
                                                           case "equals":
                                                               return proxy == args[0];
                                                           case "toString":
                                                               return "ConnectionThatCannotBeginTransactions";
                                                           default:
                                                               return defaultValueFor(method.getReturnType());
                                                       }
                                                   });
    }

    private static Object defaultValueFor(Class<?> returnType) {
        if (!returnType.isPrimitive() || returnType == void.class) {
            return null;
        }
        if (returnType == boolean.class) {
            return false;
        }
        if (returnType == long.class) {
            return 0L;
        }
        return 0;
    }
}

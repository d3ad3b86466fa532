package org.netpreserve.newsagger.util;

import org.jdbi.v3.core.statement.StatementContext;
import org.jdbi.v3.core.statement.StatementCustomizer;
import org.jdbi.v3.sqlobject.customizer.SqlStatementCustomizer;
import org.jdbi.v3.sqlobject.customizer.SqlStatementCustomizerFactory;
import org.jdbi.v3.sqlobject.customizer.SqlStatementCustomizingAnnotation;

import java.lang.annotation.*;
import java.lang.reflect.Method;
import java.sql.PreparedStatement;
import java.sql.SQLException;

/**
 * Fails a DAO update that touched the wrong number of rows, typically because the target row doesn't exist.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.METHOD})
@SqlStatementCustomizingAnnotation(MustUpdate.Handler.class)
public @interface MustUpdate {
    /**
     * Exact number of rows expected to change, or -1 for "at least one".
     */
    int value() default -1;

    class Handler implements SqlStatementCustomizerFactory {
        @Override
        public SqlStatementCustomizer createForMethod(Annotation annotation, Class<?> sqlObjectType, Method method) {
            int expected = ((MustUpdate) annotation).value();
            String name = method.getDeclaringClass().getSimpleName() + "." + method.getName() + "()";
            return stmt -> stmt.addCustomizer(new RowCountCheck(name, expected));
        }
    }

    class RowCountCheck implements StatementCustomizer {
        private final String name;
        private final int expected;

        RowCountCheck(String name, int expected) {
            this.name = name;
            this.expected = expected;
        }

        @Override
        public void afterExecution(PreparedStatement stmt, StatementContext ctx) throws SQLException {
            long updated = stmt.getUpdateCount();
            if (expected == -1 && updated == 0) {
                throw new Exception(name + " didn't update any rows");
            } else if (expected != -1 && updated != expected) {
                throw new Exception(name + " expected to update " + expected + " rows but updated " + updated);
            }
        }
    }

    class Exception extends RuntimeException {
        public Exception(String message) {
            super(message);
        }
    }
}

package org.netpreserve.newsagger;

import org.junit.jupiter.api.extension.*;

public class InMemoryDatabaseTestExtension implements BeforeAllCallback, AfterAllCallback, ParameterResolver {

    private static Database sharedDatabase;

    @Override
    public void beforeAll(ExtensionContext context) {
        if (sharedDatabase == null) {
            sharedDatabase = Database.newDatabaseInMemory();
        }
    }

    @Override
    public void afterAll(ExtensionContext context) {
        if (sharedDatabase != null) {
            sharedDatabase.close();
            sharedDatabase = null;
        }
    }

    @Override
    public boolean supportsParameter(ParameterContext parameterContext, ExtensionContext extensionContext) {
        return parameterContext.getParameter().getType() == Database.class;
    }

    @Override
    public Object resolveParameter(ParameterContext parameterContext, ExtensionContext extensionContext) {
        return sharedDatabase;
    }

    /**
     * Empties every table, children first.
     */
    public static void clear(Database database) {
        database.useHandle(handle -> {
            handle.execute("DELETE FROM download_queue");
            handle.execute("DELETE FROM pages");
            handle.execute("DELETE FROM periodical_issues");
            handle.execute("DELETE FROM search_facets");
            handle.execute("DELETE FROM batch_sessions");
            handle.execute("DELETE FROM periodicals");
        });
    }
}

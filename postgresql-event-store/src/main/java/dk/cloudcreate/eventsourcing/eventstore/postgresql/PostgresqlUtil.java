package dk.cloudcreate.eventsourcing.eventstore.postgresql;

import java.util.*;
import java.util.regex.Pattern;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Table and column names can't be bound as SQL parameters, so they're validated before they're used to build SQL statements
 */
public final class PostgresqlUtil {
    private static final Pattern     VALID_SQL_IDENTIFIER = Pattern.compile("^[a-zA-Z_][a-zA-Z0-9_]{0,62}$");
    private static final Set<String> RESERVED_KEYWORDS    = Set.of("all", "and", "any", "as", "asc", "between", "by", "case", "check", "column",
                                                                   "constraint", "create", "delete", "desc", "distinct", "drop", "else", "end",
                                                                   "exists", "false", "from", "grant", "group", "having", "in", "insert", "into",
                                                                   "is", "join", "like", "limit", "not", "null", "offset", "on", "or", "order",
                                                                   "primary", "references", "select", "table", "then", "to", "true", "union",
                                                                   "unique", "update", "user", "using", "values", "when", "where", "with");

    private PostgresqlUtil() {
    }

    /**
     * @param tableOrColumnName the table or column name
     * @throws InvalidTableOrColumnNameException in case the name isn't a valid unquoted Postgresql identifier or is a reserved keyword
     */
    public static void checkIsValidTableOrColumnName(String tableOrColumnName) {
        requireNonNull(tableOrColumnName, "No tableOrColumnName provided");
        if (!VALID_SQL_IDENTIFIER.matcher(tableOrColumnName).matches()) {
            throw new InvalidTableOrColumnNameException(msg("'{}' is not a valid table or column name", tableOrColumnName));
        }
        if (RESERVED_KEYWORDS.contains(tableOrColumnName.toLowerCase(Locale.ROOT))) {
            throw new InvalidTableOrColumnNameException(msg("'{}' is a reserved keyword and can't be used as table or column name", tableOrColumnName));
        }
    }

    public static class InvalidTableOrColumnNameException extends IllegalArgumentException {
        public InvalidTableOrColumnNameException(String message) {
            super(message);
        }
    }
}

package org.carball.adapt.parser;

import lombok.extern.slf4j.Slf4j;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.expression.AnyComparisonExpression;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.ExpressionVisitorAdapter;
import net.sf.jsqlparser.expression.operators.relational.ExistsExpression;
import net.sf.jsqlparser.expression.operators.relational.InExpression;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.schema.Column;
import net.sf.jsqlparser.schema.Table;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.create.view.CreateView;
import net.sf.jsqlparser.statement.delete.Delete;
import net.sf.jsqlparser.statement.insert.Insert;
import net.sf.jsqlparser.statement.select.FromItem;
import net.sf.jsqlparser.statement.select.Join;
import net.sf.jsqlparser.statement.select.OrderByElement;
import net.sf.jsqlparser.statement.select.ParenthesedFromItem;
import net.sf.jsqlparser.statement.select.ParenthesedSelect;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.Select;
import net.sf.jsqlparser.statement.select.SelectItem;
import net.sf.jsqlparser.statement.select.SetOperationList;
import net.sf.jsqlparser.statement.select.WithItem;
import net.sf.jsqlparser.statement.update.Update;
import org.carball.adapt.model.query.ColumnReference;
import org.carball.adapt.model.query.ExtractionResult;
import org.carball.adapt.model.schema.TableNames;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Extracts the columns a query filters or joins on, resolved to their tables.
 * <p>
 * Columns inside {@code JOIN ... ON/USING} conditions and {@code WHERE} clauses are
 * predicate columns. Columns that only appear in the select list, {@code GROUP BY},
 * {@code HAVING} or {@code ORDER BY} are referenced but not predicate columns.
 * Unqualified columns resolve to the only table in scope, or to the only table in
 * scope whose known columns contain the name; anything else is counted as unresolved.
 */
@Slf4j
public class PredicateExtractor {

    private static final Set<String> NON_COLUMN_IDENTIFIERS = Set.of(
            "true", "false", "current_date", "current_time", "current_timestamp", "localtime", "localtimestamp");

    private final Map<String, Set<String>> knownColumns;

    public PredicateExtractor() {
        this(Map.of());
    }

    /**
     * @param knownColumns column names per table, keyed by simple table name, used
     *                     to resolve unqualified columns in multi-table queries
     */
    public PredicateExtractor(Map<String, Set<String>> knownColumns) {
        Map<String, Set<String>> normalized = new HashMap<>();
        knownColumns.forEach((table, columns) -> {
            Set<String> names = new HashSet<>();
            columns.forEach(column -> names.add(TableNames.normalizeIdentifier(column)));
            normalized.put(TableNames.simpleName(table), names);
        });
        this.knownColumns = normalized;
    }

    public ExtractionResult extract(String sql) {
        if (sql == null || sql.isBlank()) {
            return ExtractionResult.parseFailure("Empty SQL text");
        }

        Statement statement;
        try {
            statement = CCJSqlParserUtil.parse(preprocessSql(sql));
        } catch (JSQLParserException | RuntimeException e) {
            return ExtractionResult.parseFailure(firstLine(e.getMessage()));
        }

        Collector collector = new Collector();
        collector.collectStatement(statement);
        return collector.toResult();
    }

    private static String preprocessSql(String sql) {
        String processed = sql.trim();
        while (processed.endsWith(";")) {
            processed = processed.substring(0, processed.length() - 1).trim();
        }
        return processed;
    }

    private static String firstLine(String message) {
        if (message == null) {
            return "Unparseable SQL";
        }
        int newline = message.indexOf('\n');
        return newline >= 0 ? message.substring(0, newline).trim() : message.trim();
    }

    /**
     * Tables and aliases visible to the expressions of one SELECT.
     */
    private static final class Scope {
        private final Scope parent;
        private final Map<String, String> baseTablesByName = new LinkedHashMap<>();
        private final Set<String> derivedNames = new HashSet<>();
        private final List<String> baseTables = new ArrayList<>();

        private Scope(Scope parent) {
            this.parent = parent;
        }

        private void registerTable(String table, String alias) {
            if (!baseTables.contains(table)) {
                baseTables.add(table);
            }
            baseTablesByName.put(table, table);
            if (alias != null) {
                baseTablesByName.put(alias, table);
            }
        }

        private void registerDerived(String alias) {
            if (alias != null) {
                derivedNames.add(alias);
            }
        }

        private String resolveQualifier(String qualifier) {
            for (Scope scope = this; scope != null; scope = scope.parent) {
                if (scope.derivedNames.contains(qualifier)) {
                    return null;
                }
                String table = scope.baseTablesByName.get(qualifier);
                if (table != null) {
                    return table;
                }
            }
            return null;
        }
    }

    private final class Collector {
        private final Set<String> sourceTables = new HashSet<>();
        private final Set<ColumnReference> predicateColumns = new HashSet<>();
        private final Set<ColumnReference> referencedColumns = new HashSet<>();
        private int unresolved;

        private void collectStatement(Statement statement) {
            if (statement instanceof Select select) {
                collectSelect(select, null);
            } else if (statement instanceof CreateView createView) {
                if (createView.getSelect() != null) {
                    collectSelect(createView.getSelect(), null);
                }
            } else if (statement instanceof Insert insert) {
                if (insert.getSelect() != null) {
                    collectSelect(insert.getSelect(), null);
                }
            } else if (statement instanceof Update update) {
                collectFilteredTable(update.getTable(), update.getWhere());
            } else if (statement instanceof Delete delete) {
                collectFilteredTable(delete.getTable(), delete.getWhere());
            } else {
                log.debug("Statement type {} carries no column predicates", statement.getClass().getSimpleName());
            }
        }

        private void collectFilteredTable(Table table, Expression where) {
            Scope scope = new Scope(null);
            registerFromItem(table, scope, new ArrayList<>());
            if (where != null) {
                where.accept(new ColumnVisitor(scope, true));
            }
        }

        private void collectSelect(Select select, Scope parent) {
            if (select.getWithItemsList() != null) {
                for (WithItem withItem : select.getWithItemsList()) {
                    Select body = withItem.getSelect();
                    if (body != null) {
                        collectSelect(body, parent);
                    }
                }
            }

            if (select instanceof PlainSelect plainSelect) {
                collectPlainSelect(plainSelect, parent);
            } else if (select instanceof SetOperationList setOperationList) {
                for (Select branch : setOperationList.getSelects()) {
                    collectSelect(branch, parent);
                }
            } else if (select instanceof ParenthesedSelect parenthesedSelect) {
                collectSelect(parenthesedSelect.getSelect(), parent);
            }
        }

        private void collectPlainSelect(PlainSelect select, Scope parent) {
            Scope scope = new Scope(parent);
            List<Join> joins = new ArrayList<>();

            registerFromItem(select.getFromItem(), scope, joins);
            if (select.getJoins() != null) {
                for (Join join : select.getJoins()) {
                    joins.add(join);
                    registerFromItem(join.getRightItem(), scope, joins);
                }
            }

            ColumnVisitor predicates = new ColumnVisitor(scope, true);
            ColumnVisitor references = new ColumnVisitor(scope, false);

            if (select.getWhere() != null) {
                select.getWhere().accept(predicates);
            }
            for (Join join : joins) {
                if (join.getOnExpressions() != null) {
                    for (Expression on : join.getOnExpressions()) {
                        on.accept(predicates);
                    }
                }
                if (join.getUsingColumns() != null) {
                    for (Column using : join.getUsingColumns()) {
                        recordUsingColumn(using, scope);
                    }
                }
            }

            if (select.getSelectItems() != null) {
                for (SelectItem<?> item : select.getSelectItems()) {
                    if (item.getExpression() != null) {
                        item.getExpression().accept(references);
                    }
                }
            }
            if (select.getGroupBy() != null && select.getGroupBy().getGroupByExpressionList() != null) {
                select.getGroupBy().getGroupByExpressionList().accept(references);
            }
            if (select.getHaving() != null) {
                select.getHaving().accept(references);
            }
            if (select.getOrderByElements() != null) {
                for (OrderByElement orderBy : select.getOrderByElements()) {
                    orderBy.getExpression().accept(references);
                }
            }
        }

        private void registerFromItem(FromItem fromItem, Scope scope, List<Join> joins) {
            if (fromItem == null) {
                return;
            }
            String alias = fromItem.getAlias() != null
                    ? TableNames.normalizeIdentifier(fromItem.getAlias().getName())
                    : null;

            if (fromItem instanceof Table table) {
                String tableName = TableNames.simpleName(table.getName());
                scope.registerTable(tableName, alias);
                sourceTables.add(tableName);
            } else if (fromItem instanceof ParenthesedSelect parenthesedSelect) {
                scope.registerDerived(alias);
                collectSelect(parenthesedSelect.getSelect(), null);
            } else if (fromItem instanceof ParenthesedFromItem parenthesedFromItem) {
                registerFromItem(parenthesedFromItem.getFromItem(), scope, joins);
                if (parenthesedFromItem.getJoins() != null) {
                    for (Join join : parenthesedFromItem.getJoins()) {
                        joins.add(join);
                        registerFromItem(join.getRightItem(), scope, joins);
                    }
                }
            } else {
                scope.registerDerived(alias);
                log.debug("Skipping unsupported FROM item {}", fromItem.getClass().getSimpleName());
            }
        }

        private void recordUsingColumn(Column column, Scope scope) {
            String name = TableNames.normalizeIdentifier(column.getColumnName());
            boolean resolved = false;
            for (String table : scope.baseTables) {
                Set<String> columns = knownColumns.get(table);
                if (columns == null || columns.contains(name)) {
                    record(new ColumnReference(table, name), true);
                    resolved = true;
                }
            }
            if (!resolved) {
                unresolved++;
            }
        }

        private void recordColumn(Column column, Scope scope, boolean predicate) {
            String name = TableNames.normalizeIdentifier(column.getColumnName());
            Table qualifierTable = column.getTable();
            String qualifier = qualifierTable != null && qualifierTable.getName() != null
                    ? TableNames.normalizeIdentifier(qualifierTable.getName())
                    : null;

            if (qualifier == null && NON_COLUMN_IDENTIFIERS.contains(name)) {
                return;
            }

            String table = qualifier != null ? scope.resolveQualifier(qualifier) : resolveUnqualified(name, scope);
            if (table == null) {
                unresolved++;
                log.debug("Unresolved column reference {}{}", qualifier != null ? qualifier + "." : "", name);
                return;
            }
            record(new ColumnReference(table, name), predicate);
        }

        private String resolveUnqualified(String name, Scope scope) {
            for (Scope current = scope; current != null; current = current.parent) {
                if (current.baseTables.size() == 1 && current.derivedNames.isEmpty()) {
                    return current.baseTables.get(0);
                }
                List<String> candidates = new ArrayList<>();
                for (String table : current.baseTables) {
                    Set<String> columns = knownColumns.get(table);
                    if (columns != null && columns.contains(name)) {
                        candidates.add(table);
                    }
                }
                if (candidates.size() == 1) {
                    return candidates.get(0);
                }
                if (candidates.size() > 1 || !current.baseTables.isEmpty()) {
                    return null;
                }
            }
            return null;
        }

        private void record(ColumnReference reference, boolean predicate) {
            referencedColumns.add(reference);
            if (predicate) {
                predicateColumns.add(reference);
            }
        }

        private ExtractionResult toResult() {
            return ExtractionResult.resolved(sourceTables, predicateColumns, referencedColumns, unresolved);
        }

        /**
         * Records every column an expression touches. Subqueries (scalar, IN, EXISTS,
         * ANY/ALL) are collected with the enclosing scope as parent so correlated
         * references resolve.
         */
        private final class ColumnVisitor extends ExpressionVisitorAdapter {
            private final Scope scope;
            private final boolean predicate;

            private ColumnVisitor(Scope scope, boolean predicate) {
                this.scope = scope;
                this.predicate = predicate;
            }

            @Override
            public void visit(Column column) {
                recordColumn(column, scope, predicate);
            }

            @Override
            public void visit(InExpression inExpression) {
                if (inExpression.getLeftExpression() != null) {
                    inExpression.getLeftExpression().accept(this);
                }
                Expression right = inExpression.getRightExpression();
                if (right instanceof Select subquery) {
                    collectSelect(subquery, scope);
                } else if (right != null) {
                    right.accept(this);
                }
            }

            @Override
            public void visit(ParenthesedSelect subquery) {
                collectSelect(subquery, scope);
            }

            @Override
            public void visit(Select subquery) {
                collectSelect(subquery, scope);
            }

            @Override
            public void visit(AnyComparisonExpression anyComparisonExpression) {
                if (anyComparisonExpression.getSelect() != null) {
                    collectSelect(anyComparisonExpression.getSelect(), scope);
                }
            }

            @Override
            public void visit(ExistsExpression existsExpression) {
                Expression right = existsExpression.getRightExpression();
                if (right instanceof Select subquery) {
                    collectSelect(subquery, scope);
                } else if (right != null) {
                    right.accept(this);
                }
            }
        }
    }
}

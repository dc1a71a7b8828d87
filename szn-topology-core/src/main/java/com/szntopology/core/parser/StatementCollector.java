package com.szntopology.core.parser;

import com.szntopology.core.model.Endpoint;
import org.antlr.v4.runtime.ParserRuleContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns an SZN parse tree into an ordered list of {@link Statement}s,
 * coercing attribute values on the way.
 */
class StatementCollector extends SznBaseVisitor<Statement> {

    private static final Logger log = LoggerFactory.getLogger(StatementCollector.class);

    private final SourceLines lines;
    private final boolean warnOnRepeatedKeys;

    StatementCollector(SourceLines lines, boolean warnOnRepeatedKeys) {
        this.lines = lines;
        this.warnOnRepeatedKeys = warnOnRepeatedKeys;
    }

    List<Statement> collect(SznParser.TopologyContext topology) {
        List<Statement> statements = new ArrayList<>();
        for (SznParser.StatementContext context : topology.statement()) {
            Statement statement = visit(context);
            log.debug("Line number {}: {}", statement.line(), statement);
            statements.add(statement);
        }
        return statements;
    }

    @Override
    public Statement visitLinkStatement(SznParser.LinkStatementContext ctx) {
        List<Statement.Connection> links = new ArrayList<>();
        for (SznParser.LinkContext link : ctx.link()) {
            links.add(new Statement.Connection(endpoint(link.endpoint(0)), endpoint(link.endpoint(1))));
        }
        return new Statement.Links(line(ctx), attributes(ctx.attributeBlock()), links);
    }

    @Override
    public Statement visitPortStatement(SznParser.PortStatementContext ctx) {
        List<Endpoint> ports = ctx.endpoint().stream()
            .map(this::endpoint)
            .toList();
        return new Statement.Ports(line(ctx), attributes(ctx.attributeBlock()), ports);
    }

    @Override
    public Statement visitNodeStatement(SznParser.NodeStatementContext ctx) {
        List<String> nodes = new ArrayList<>();
        for (SznParser.NodeIdContext node : ctx.nodeId()) {
            String id = node.getText();
            if (nodes.contains(id)) {
                log.warn("Repeated node name {} in line #{}: \"{}\"", id, line(ctx), lines.line(line(ctx)));
                continue;
            }
            nodes.add(id);
        }
        return new Statement.Nodes(line(ctx), attributes(ctx.attributeBlock()), nodes);
    }

    @Override
    public Statement visitEnvironmentStatement(SznParser.EnvironmentStatementContext ctx) {
        return new Statement.Environment(line(ctx), attributes(ctx.attributeBlock()));
    }

    private Endpoint endpoint(SznParser.EndpointContext ctx) {
        return new Endpoint(ctx.nodeId().getText(), ctx.portLabel().getText());
    }

    private Map<String, Object> attributes(SznParser.AttributeBlockContext block) {
        if (block == null) {
            return Collections.emptyMap();
        }
        Map<String, Object> attributes = new LinkedHashMap<>();
        for (SznParser.AttributeContext attribute : block.attribute()) {
            String key = attribute.IDENTIFIER().getText();
            Object value = value(attribute.value());
            if (warnOnRepeatedKeys && attributes.containsKey(key)) {
                int line = line(attribute);
                log.warn("Repeated key in line #{}: \"{}\"", line, lines.line(line));
                log.warn("Overriding \"{}\" value from \"{}\" to \"{}\"", key, attributes.get(key), value);
            }
            attributes.put(key, value);
        }
        return attributes;
    }

    private Object value(SznParser.ValueContext ctx) {
        if (ctx.valueList() != null) {
            List<Object> values = new ArrayList<>();
            for (SznParser.ScalarContext scalar : ctx.valueList().scalar()) {
                values.add(scalar(scalar));
            }
            return Collections.unmodifiableList(values);
        }
        return scalar(ctx.scalar());
    }

    private Object scalar(SznParser.ScalarContext ctx) {
        if (ctx instanceof SznParser.QuotedScalarContext quoted) {
            return AttributeValues.quoted(quoted.QUOTED_STRING().getText());
        }
        if (ctx instanceof SznParser.NumberScalarContext number) {
            String sign = number.sign == null ? "" : number.sign.getText();
            String digits = number.INTEGER() != null ? number.INTEGER().getText() : number.FLOAT().getText();
            return AttributeValues.number(sign + digits);
        }
        return AttributeValues.identifier(ctx.getText());
    }

    private static int line(ParserRuleContext ctx) {
        return ctx.getStart().getLine();
    }
}

package io.safecalc.standalone.adapter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.http.Context;
import io.javalin.http.HandlerType;
import io.safecalc.core.error.CalcException;
import io.safecalc.core.error.ExpressionLimitException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bridges Javalin requests and the calculator engine.
 *
 * <p>
 * Reads the expression from a request ({@code {"expression": "..."}} body for
 * POST, {@code ?expression=} for GET), applies caller-side input translation,
 * and builds the success body
 * {@code {"expression": ..., "result": ..., "display": ...}}.
 *
 * <p>
 * This class is thread-safe; all state is local to each method invocation.
 */
public final class StandaloneAdapter {

    private static final Logger LOG = LoggerFactory.getLogger(StandaloneAdapter.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** Name of the JSON field and query parameter carrying the expression. */
    public static final String EXPRESSION_FIELD = "expression";

    private final boolean caretAsPower;
    private final int maxInputLength;
    private final ResultFormatter formatter;

    /**
     * @param caretAsPower   rewrite {@code ^} to {@code **} before evaluation
     * @param maxInputLength limit, in code points, on the text as the client
     *                       sent it
     * @param formatter      produces the {@code display} field
     */
    public StandaloneAdapter(boolean caretAsPower, int maxInputLength, ResultFormatter formatter) {
        this.caretAsPower = caretAsPower;
        this.maxInputLength = maxInputLength;
        this.formatter = formatter;
    }

    /**
     * Extracts the expression text from the request.
     *
     * @param ctx the Javalin request context
     * @return the expression exactly as the client sent it
     * @throws IllegalArgumentException if the body is not a JSON object with a
     *                                  string {@code expression} field, or the
     *                                  query parameter is missing
     */
    public String readExpression(Context ctx) {
        if (ctx.method() == HandlerType.GET) {
            String expression = ctx.queryParam(EXPRESSION_FIELD);
            if (expression == null) {
                throw new IllegalArgumentException("Missing query parameter '" + EXPRESSION_FIELD + "'");
            }
            return expression;
        }
        return parseBody(ctx.body());
    }

    /**
     * Checks the client's text against the input limit, then applies
     * caller-side translation (currently only the caret shorthand).
     *
     * @throws ExpressionLimitException if the untranslated text is too long
     */
    public String toEngineInput(String expression) {
        int codePoints = expression.codePointCount(0, expression.length());
        if (codePoints > maxInputLength) {
            throw new ExpressionLimitException(
                    "Expression is " + codePoints + " characters long; the limit is " + maxInputLength,
                    ExpressionLimitException.Limit.INPUT_LENGTH,
                    CalcException.Phase.PARSE);
        }
        if (caretAsPower && expression.indexOf('^') >= 0) {
            LOG.debug("Translating '^' to '**'");
            return expression.replace("^", "**");
        }
        return expression;
    }

    /**
     * Builds the 200 response body. Non-finite results are written as strings
     * because JSON has no representation for them.
     */
    public ObjectNode successBody(String expression, double value) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put(EXPRESSION_FIELD, expression);
        String nonFinite = ResultFormatter.nonFinite(value);
        if (nonFinite != null) {
            node.put("result", nonFinite);
        } else {
            node.put("result", value);
        }
        node.put("display", formatter.format(value));
        return node;
    }

    private static String parseBody(String body) {
        if (body == null || body.isBlank()) {
            throw new IllegalArgumentException("Request body must be a JSON object with an '" + EXPRESSION_FIELD
                    + "' field");
        }
        JsonNode root;
        try {
            root = MAPPER.readTree(body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Request body is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Request body must be a JSON object");
        }
        JsonNode expression = root.get(EXPRESSION_FIELD);
        if (expression == null || expression.isNull()) {
            throw new IllegalArgumentException("Missing field '" + EXPRESSION_FIELD + "'");
        }
        if (!expression.isTextual()) {
            throw new IllegalArgumentException("Field '" + EXPRESSION_FIELD + "' must be a string");
        }
        return expression.textValue();
    }
}

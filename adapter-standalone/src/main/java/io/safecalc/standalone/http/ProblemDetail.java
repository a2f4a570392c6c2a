package io.safecalc.standalone.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.safecalc.core.error.ArithmeticEvalException;
import io.safecalc.core.error.CalcException;
import io.safecalc.core.error.CalcParseException;
import io.safecalc.core.error.DisallowedNodeException;
import io.safecalc.core.error.ExpressionLimitException;
import io.safecalc.core.error.ExpressionSyntaxException;
import io.safecalc.core.error.FunctionNotAllowedException;
import io.safecalc.core.error.UnknownIdentifierException;

/**
 * Builds RFC 9457 Problem Details bodies.
 *
 * <p>
 * Calculator rejections map by phase: anything detected while parsing is the
 * client's malformed input ({@code 400}); anything detected while evaluating is
 * a well-formed expression that cannot be computed ({@code 422}). The problem
 * {@code type} is the exception's URN. Request-level failures use the
 * {@code urn:safecalc:http:*} types.
 *
 * <pre>{@code
 * {
 *   "type": "urn:safecalc:error:arithmetic",
 *   "title": "Arithmetic Error",
 *   "status": 422,
 *   "detail": "division by zero",
 *   "instance": "/evaluate",
 *   "reason": "DIVISION_BY_ZERO"
 * }
 * }</pre>
 */
public final class ProblemDetail {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String URN_BAD_REQUEST = "urn:safecalc:http:bad-request";
    static final String URN_BODY_TOO_LARGE = "urn:safecalc:http:body-too-large";
    static final String URN_NOT_FOUND = "urn:safecalc:http:not-found";
    static final String URN_HTTP_ERROR = "urn:safecalc:http:error";
    static final String URN_INTERNAL_ERROR = "urn:safecalc:http:internal-error";

    /** Media type of every problem body. */
    public static final String CONTENT_TYPE = "application/problem+json";

    private ProblemDetail() {
        // utility class
    }

    /**
     * Maps a calculator rejection to a problem body.
     *
     * @param error        the rejection
     * @param instancePath the request path
     */
    public static ObjectNode fromCalcException(CalcException error, String instancePath) {
        int status = error.phase() == CalcException.Phase.PARSE ? 400 : 422;
        ObjectNode node = build(error.type(), titleFor(error.type()), status, error.detail(), instancePath);
        if (error instanceof CalcParseException) {
            node.put("position", ((CalcParseException) error).position());
        }
        if (error instanceof ArithmeticEvalException) {
            node.put("reason", ((ArithmeticEvalException) error).reason().name());
        }
        if (error instanceof ExpressionLimitException) {
            node.put("limit", ((ExpressionLimitException) error).limit().name());
        }
        return node;
    }

    /** Body missing, not JSON, or without an {@code expression}. */
    public static ObjectNode badRequest(String detail, String instancePath) {
        return build(URN_BAD_REQUEST, "Bad Request", 400, detail, instancePath);
    }

    /** Request body exceeds {@code server.max-body-bytes}. */
    public static ObjectNode bodyTooLarge(String detail, String instancePath) {
        return build(URN_BODY_TOO_LARGE, "Payload Too Large", 413, detail, instancePath);
    }

    public static ObjectNode notFound(String detail, String instancePath) {
        return build(URN_NOT_FOUND, "Not Found", 404, detail, instancePath);
    }

    /** Any other status raised by the HTTP layer itself. */
    public static ObjectNode httpError(int status, String detail, String instancePath) {
        return build(URN_HTTP_ERROR, "HTTP Error", status, detail, instancePath);
    }

    public static ObjectNode internalError(String detail, String instancePath) {
        return build(URN_INTERNAL_ERROR, "Internal Server Error", 500, detail, instancePath);
    }

    static String titleFor(String type) {
        switch (type) {
            case ExpressionSyntaxException.TYPE:
                return "Syntax Error";
            case ExpressionLimitException.TYPE:
                return "Expression Too Complex";
            case DisallowedNodeException.TYPE:
                return "Disallowed Expression";
            case UnknownIdentifierException.TYPE:
                return "Unknown Identifier";
            case FunctionNotAllowedException.TYPE:
                return "Function Not Allowed";
            case ArithmeticEvalException.TYPE:
                return "Arithmetic Error";
            default:
                return "Evaluation Error";
        }
    }

    /**
     * Builds a standard RFC 9457 object.
     *
     * @param instancePath request path, may be null
     */
    static ObjectNode build(String type, String title, int status, String detail, String instancePath) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("type", type);
        node.put("title", title);
        node.put("status", status);
        node.put("detail", detail);
        if (instancePath != null) {
            node.put("instance", instancePath);
        } else {
            node.putNull("instance");
        }
        return node;
    }
}

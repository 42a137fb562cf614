package fun.fengwk.msh.core.mcp;

import org.springframework.ai.tool.execution.ToolCallResultConverter;

import java.lang.reflect.Type;

/**
 * Passes formatted text tool results through unchanged.
 *
 * @author fengwk
 */
public class TextToolCallResultConverter implements ToolCallResultConverter {

    @Override
    public String convert(Object result, Type returnType) {
        if (result == null) {
            return "";
        }
        if (result instanceof CharSequence cs) {
            return cs.toString();
        }
        throw new IllegalStateException("unsupported result type: " + result.getClass());
    }

}

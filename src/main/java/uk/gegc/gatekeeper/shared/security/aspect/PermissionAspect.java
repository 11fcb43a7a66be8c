package uk.gegc.gatekeeper.shared.security.aspect;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.JoinPoint;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.annotation.Before;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.context.expression.MethodBasedEvaluationContext;
import org.springframework.core.DefaultParameterNameDiscoverer;
import org.springframework.core.ParameterNameDiscoverer;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.stereotype.Component;
import uk.gegc.gatekeeper.shared.exception.UnauthorizedException;
import uk.gegc.gatekeeper.shared.security.AccessGuard;
import uk.gegc.gatekeeper.shared.security.ResourceContext;
import uk.gegc.gatekeeper.shared.security.SubjectIdProvider;
import uk.gegc.gatekeeper.shared.security.annotation.RequireMinimumRole;
import uk.gegc.gatekeeper.shared.security.annotation.RequirePermission;

import java.lang.reflect.Method;
import java.util.Arrays;

/**
 * Applies {@link RequirePermission} and {@link RequireMinimumRole} through
 * {@link AccessGuard}, so annotated methods and direct guard calls share one
 * decision path.
 */
@Aspect
@Component
@RequiredArgsConstructor
@Slf4j
public class PermissionAspect {

    private final AccessGuard accessGuard;
    private final SubjectIdProvider subjectIdProvider;

    private final ExpressionParser expressionParser = new SpelExpressionParser();
    private final ParameterNameDiscoverer parameterNameDiscoverer = new DefaultParameterNameDiscoverer();

    @Before("@annotation(requirePermission)")
    public void checkPermission(JoinPoint joinPoint, RequirePermission requirePermission) {
        String subjectId = currentSubject(joinPoint);
        EvaluationContext evaluationContext = evaluationContext(joinPoint);

        accessGuard.require(
                subjectId,
                evaluate(requirePermission.organizationId(), evaluationContext),
                Arrays.asList(requirePermission.value()),
                requirePermission.operator(),
                () -> ResourceContext.of(
                        evaluate(requirePermission.ownerId(), evaluationContext),
                        evaluate(requirePermission.teamId(), evaluationContext)));
    }

    @Before("@annotation(requireMinimumRole)")
    public void checkMinimumRole(JoinPoint joinPoint, RequireMinimumRole requireMinimumRole) {
        String subjectId = currentSubject(joinPoint);
        String organizationId = evaluate(requireMinimumRole.organizationId(), evaluationContext(joinPoint));
        accessGuard.requireMinimumRole(subjectId, organizationId, requireMinimumRole.value().getRoleName());
    }

    private String currentSubject(JoinPoint joinPoint) {
        return subjectIdProvider.currentSubjectId().orElseThrow(() -> {
            log.warn("Unauthenticated call to guarded method {}", joinPoint.getSignature().toShortString());
            return new UnauthorizedException("Authentication required");
        });
    }

    private EvaluationContext evaluationContext(JoinPoint joinPoint) {
        Method method = ((MethodSignature) joinPoint.getSignature()).getMethod();
        return new MethodBasedEvaluationContext(joinPoint.getTarget(), method, joinPoint.getArgs(),
                parameterNameDiscoverer);
    }

    private String evaluate(String expression, EvaluationContext evaluationContext) {
        if (expression == null || expression.isBlank()) {
            return null;
        }
        Object value = expressionParser.parseExpression(expression).getValue(evaluationContext);
        return value != null ? value.toString() : null;
    }
}

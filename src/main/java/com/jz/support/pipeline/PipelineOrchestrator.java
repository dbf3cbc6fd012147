package com.jz.support.pipeline;

import com.jz.support.agent.*;
import com.jz.support.assemble.ResponseAssembler;
import com.jz.support.config.PipelineProperties;
import com.jz.support.domain.*;
import com.jz.support.eval.AbstractEvaluationGate;
import com.jz.support.eval.EvalOutcome;
import com.jz.support.eval.EvalRequest;
import com.jz.support.eval.EvaluationGate;
import com.jz.support.eval.QaEvaluationGate;
import com.jz.support.guard.GuardReplies;
import com.jz.support.guard.RedLineVerdict;
import com.jz.support.guard.SafetyGuard;
import com.jz.support.service.SupportLogService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * 客服回复流水线：
 * 1 红线 -> 2 分类 ∥ 取名 -> 3 拼输入 -> 4 生成 ∥ 特殊案件检测 -> 5 退订链接 + 拼装
 * -> 6 评估（团队模式可重试一次 4~6）-> 7 异步落库。
 * 对调用方永不抛异常：任何内部失败都转成 escalate。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PipelineOrchestrator {

    static final String UNKNOWN_CATEGORY = "unknown";
    static final String REFINE_COERCED = "Refine not allowed on retry, forced to draft";

    private final SafetyGuard safetyGuard;
    private final Classifier classifier;
    private final NameExtractor nameExtractor;
    private final ContextProvider contextProvider;
    private final ReplyGenerator replyGenerator;
    private final OutstandingDetector outstandingDetector;
    private final LinkGenerator linkGenerator;
    private final ResponseAssembler assembler;
    private final EvaluationGate evaluationGate;
    private final QaEvaluationGate qaEvaluationGate;
    private final SupportLogService supportLogService;
    private final PipelineProperties props;
    private final MeterRegistry meterRegistry;
    @Qualifier("pipelineExecutor")
    private final Executor pipelineExecutor;

    private Timer latencyTimer;

    @PostConstruct
    void init() {
        this.latencyTimer = Timer.builder("support.pipeline.latency")
                .description("end-to-end pipeline latency, persistence excluded")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry);
    }

    public PipelineResult process(PipelineRequest request) {
        Timer.Sample sample = Timer.start(meterRegistry);
        RequestContext ctx = new RequestContext(request == null ? PipelineRequest.builder().build() : request,
                props.isTeamMode(), props.getDefaultChannel());
        log.info("pipeline start. sessionId={}, teamMode={}, channel={}", ctx.getSessionId(), ctx.isTeamMode(), ctx.getChannel());

        PipelineResult result;
        try {
            if (request == null) throw new IllegalArgumentException("request is required");
            result = run(ctx);
        } catch (Exception e) {
            log.error("pipeline failed. sessionId={}, err={}", ctx.getSessionId(), e.toString(), e);
            result = failure(ctx, e);
        }

        sample.stop(latencyTimer);
        Counter.builder("support.pipeline.decision")
                .tag("decision", result.getDecision().value())
                .register(meterRegistry)
                .increment();
        return result;
    }

    private PipelineResult run(RequestContext ctx) {
        // Stage 1: 红线
        RedLineVerdict verdict = safetyGuard.check(ctx.getMessage());
        if (verdict.isFlagged()) {
            log.warn("red line triggered. sessionId={}, trigger={}", ctx.getSessionId(), verdict.getTrigger());
            Map<String, Object> meta = new LinkedHashMap<>();
            meta.put("escalation_reason", verdict.getTrigger());
            meta.put("processing_time_ms", ctx.elapsedMs());
            return PipelineResult.builder()
                    .response(GuardReplies.SAFETY_DEFLECTION)
                    .sessionId(ctx.getSessionId())
                    .category(UNKNOWN_CATEGORY)
                    .decision(Decision.ESCALATE)
                    .confidence(Confidence.HIGH)
                    .metadata(meta)
                    .build();
        }

        // Stage 2: 分类 ∥ 取名
        classifyAndName(ctx);

        // Stage 3: 生成输入
        ctx.setCustomerEmail(ctx.getContactEmail() != null ? ctx.getContactEmail() : ctx.getClassification().getEmail());
        List<HistoryTurn> history = contextProvider.history(ctx.getSessionId(), props.getHistoryTurns());
        ctx.setGenerationInput(GenerationInputBuilder.build(ctx.getCustomerName(), ctx.getCustomerEmail(),
                history, ctx.getMessage(), props.getTurnCharCap()));

        // Stage 4~6
        PipelineResult aborted = attempt(ctx);
        if (aborted != null) return aborted;

        // 团队模式：refine 重跑一次，带上 QA 反馈
        if (ctx.isTeamMode() && ctx.getOutcome().getDecision() == Decision.REFINE && ctx.canRetry()) {
            log.info("qa retry triggered. sessionId={}, feedback={}", ctx.getSessionId(), ctx.getOutcome().getFeedback());
            ctx.beginRetry(ctx.getOutcome().getFeedback());
            aborted = attempt(ctx);
            if (aborted != null) return aborted;
        }
        if (ctx.getOutcome().getDecision() == Decision.REFINE) {
            ctx.setOutcome(ctx.getOutcome().toBuilder().decision(Decision.DRAFT).overrideReason(REFINE_COERCED).build());
        }

        long elapsed = ctx.elapsedMs();

        // Stage 7: 落库，失败不影响结果
        try {
            supportLogService.persistAsync(snapshot(ctx, elapsed));
        } catch (Exception e) {
            log.error("persist submit failed. sessionId={}, err={}", ctx.getSessionId(), e.toString());
        }

        return success(ctx, elapsed);
    }

    private void classifyAndName(RequestContext ctx) {
        CompletableFuture<Classification> cls = CompletableFuture
                .supplyAsync(() -> classifier.classify(ctx.getMessage()), pipelineExecutor)
                .exceptionally(ex -> {
                    log.warn("classifier failed, fallback to default category. sessionId={}, err={}",
                            ctx.getSessionId(), ex.toString());
                    return Classification.fallback();
                });
        CompletableFuture<String> name = CompletableFuture
                .supplyAsync(() -> nameExtractor.extract(ctx.getMessage(), ctx.getContactName()), pipelineExecutor)
                .exceptionally(ex -> {
                    log.warn("name extractor failed. sessionId={}, err={}", ctx.getSessionId(), ex.toString());
                    return props.getDefaultName();
                });
        CompletableFuture.allOf(cls, name).join();

        Classification c = cls.join();
        if (c == null) c = Classification.fallback();
        if (c.getPrimary() == null) c.setPrimary(Category.SAFE_DEFAULT);
        if (c.getUrgency() == null) c.setUrgency(Urgency.MEDIUM);
        ctx.setClassification(c);

        String n = name.join();
        ctx.setCustomerName(n == null || n.isBlank() ? props.getDefaultName() : n);
    }

    /** 跑一轮 Stage 4~6；生成失败时返回终态结果，否则返回 null */
    private PipelineResult attempt(RequestContext ctx) {
        Category category = ctx.category();

        // Stage 4: 生成 ∥ 特殊案件检测，两者都结束后再读结果
        GenerationRequest genReq = GenerationRequest.builder()
                .category(category)
                .customerEmail(ctx.getCustomerEmail())
                .input(ctx.getGenerationInput())
                .teamMode(ctx.isTeamMode())
                .build();
        CompletableFuture<GeneratedReply> gen = CompletableFuture
                .supplyAsync(() -> replyGenerator.generate(genReq), pipelineExecutor);
        CompletableFuture<OutstandingResult> out = CompletableFuture
                .supplyAsync(() -> outstandingDetector.detect(ctx.getMessage(), category), pipelineExecutor)
                .exceptionally(ex -> {
                    log.warn("outstanding detector failed. sessionId={}, err={}", ctx.getSessionId(), ex.toString());
                    return OutstandingResult.detectionError();
                });
        try {
            CompletableFuture.allOf(gen, out).join();
        } catch (CompletionException e) {
            // 生成失败整段作废，检测结果一并丢弃
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.error("generation failed. sessionId={}, category={}, attempt={}, err={}",
                    ctx.getSessionId(), category.code(), ctx.getAttempt(), cause.toString());
            return generationFailure(ctx, cause);
        }
        GeneratedReply reply = gen.join();
        ctx.setGenerated(reply);
        OutstandingResult o = out.join();
        ctx.setOutstanding(o == null ? OutstandingResult.none() : o);

        // Stage 5: 退订链接 + 拼装
        String raw = reply.getText();
        if (category.isRetention() && ctx.getCustomerEmail() != null) {
            String ref = contextProvider.profile(ctx.getCustomerEmail())
                    .map(CustomerProfile::getSubscriptionId)
                    .filter(s -> !s.isBlank())
                    .orElse("pending");
            String url = linkGenerator.cancelLink(ref, ctx.getCustomerEmail());
            if (url != null) raw = CancelLinkSplicer.splice(raw, url);
        }
        ctx.setAssembledReply(assembler.assemble(raw, ctx.getCustomerName(), category.code(), ctx.getSessionId()));

        // Stage 6: 评估
        AbstractEvaluationGate gate = ctx.isTeamMode() ? qaEvaluationGate : evaluationGate;
        EvalRequest.EvalRequestBuilder evalReq = EvalRequest.builder()
                .customerMessage(ctx.getMessage())
                .reply(ctx.getAssembledReply())
                .category(category.code())
                .outstanding(ctx.getOutstanding().isOutstanding())
                .toolsAvailable(ctx.isTeamMode() ? category.specialist().tools() : category.tools());
        if (ctx.isTeamMode()) {
            evalReq.attempt(ctx.getAttempt())
                    .previousFeedback(ctx.getOutcome() == null ? null : ctx.getOutcome().getFeedback());
        }
        EvalOutcome outcome = gate.evaluate(evalReq.build());
        ctx.setOutcome(outcome);

        if (outcome.getDecision() != Decision.SEND && outcome.getDecision() != Decision.REFINE) {
            log.warn("evaluation not send. sessionId={}, decision={}, confidence={}, overrideReason={}, teamMode={}",
                    ctx.getSessionId(), outcome.getDecision().value(), outcome.getConfidence().value(),
                    outcome.getOverrideReason(), ctx.isTeamMode());
        }
        return null;
    }

    private PipelineResult success(RequestContext ctx, long elapsed) {
        EvalOutcome o = ctx.getOutcome();
        Classification c = ctx.getClassification();

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("processing_time_ms", elapsed);
        meta.put("is_outstanding", ctx.getOutstanding().isOutstanding());
        meta.put("outstanding_trigger", ctx.getOutstanding().getTrigger());
        meta.put("secondary_category", c.getSecondary() == null ? null : c.getSecondary().code());
        meta.put("urgency", c.getUrgency().value());
        meta.put("customer_name", ctx.getCustomerName());
        meta.put("eval_checks", o.getChecks());
        meta.put("override_reason", o.getOverrideReason());
        meta.put("model_used", ctx.getGenerated().getModel());
        meta.put("team_mode", ctx.isTeamMode());
        if (ctx.isTeamMode()) {
            meta.put("specialist", ctx.getGenerated().getSpecialist());
            meta.put("attempts", ctx.getAttempt());
        }

        return PipelineResult.builder()
                .response(ctx.getAssembledReply())
                .sessionId(ctx.getSessionId())
                .category(ctx.category().code())
                .decision(o.getDecision())
                .confidence(o.getConfidence())
                .metadata(meta)
                .build();
    }

    private PipelineResult generationFailure(RequestContext ctx, Throwable cause) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("error", String.valueOf(cause.getMessage()));
        meta.put("processing_time_ms", ctx.elapsedMs());
        meta.put("attempts", ctx.getAttempt());
        return PipelineResult.builder()
                .response(GuardReplies.PIPELINE_FAILURE)
                .sessionId(ctx.getSessionId())
                .category(ctx.category().code())
                .decision(Decision.ESCALATE)
                .confidence(Confidence.LOW)
                .metadata(meta)
                .build();
    }

    private PipelineResult failure(RequestContext ctx, Exception e) {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("error", String.valueOf(e.getMessage()));
        meta.put("processing_time_ms", ctx.elapsedMs());
        return PipelineResult.builder()
                .response(GuardReplies.PIPELINE_FAILURE)
                .sessionId(ctx.getSessionId())
                .category(ctx.category() == null ? UNKNOWN_CATEGORY : ctx.category().code())
                .decision(Decision.ESCALATE)
                .confidence(Confidence.LOW)
                .metadata(meta)
                .build();
    }

    private PersistSnapshot snapshot(RequestContext ctx, long elapsed) {
        EvalOutcome o = ctx.getOutcome();
        Classification c = ctx.getClassification();
        return PersistSnapshot.builder()
                .sessionId(ctx.getSessionId())
                .turnId(ctx.getTurnId())
                .conversationId(ctx.getConversationId())
                .channel(ctx.getChannel())
                .customerEmail(ctx.getCustomerEmail())
                .customerName(ctx.getCustomerName())
                .message(ctx.getMessage())
                .reply(ctx.getAssembledReply())
                .primary(c.getPrimary())
                .secondary(c.getSecondary())
                .urgency(c.getUrgency())
                .decision(o.getDecision())
                .confidence(o.getConfidence())
                .overrideReason(o.getOverrideReason())
                .checks(o.getChecks() == null ? List.of() : List.copyOf(o.getChecks()))
                .outstanding(ctx.getOutstanding().isOutstanding())
                .outstandingTrigger(ctx.getOutstanding().getTrigger())
                .modelUsed(ctx.getGenerated().getModel())
                .processingTimeMs(elapsed)
                .attempts(ctx.getAttempt())
                .build();
    }
}

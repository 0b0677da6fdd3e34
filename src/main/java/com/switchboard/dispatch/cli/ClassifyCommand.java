package com.switchboard.dispatch.cli;

import com.switchboard.core.engine.GatewayEngine;
import com.switchboard.core.engine.RequestPlan;
import com.switchboard.core.model.ChatRequest;
import com.switchboard.core.stream.StreamEvent;
import com.switchboard.core.stream.StreamSink;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.time.Duration;
import java.util.List;

/**
 * CLI command: switchboard classify "text"
 * <p>
 * Prints the path decision, task category and candidate chain for a message.
 * With {@code --run} the printed plan is then executed and the response
 * streamed to the terminal.
 */
@Command(name = "classify", mixinStandardHelpOptions = true,
        description = "Show how a message would be classified and routed")
@Component
public class ClassifyCommand implements Runnable {

    @Parameters(arity = "1..*", description = "The user message")
    private List<String> words;

    @Option(names = "--run", description = "Execute the request and stream the response")
    private boolean run;

    private final GatewayEngine engine;

    public ClassifyCommand(GatewayEngine engine) {
        this.engine = engine;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        ChatRequest request = ChatRequest.ofText(String.join(" ", words));
        String requestId = GatewayEngine.newRequestId();

        RequestPlan plan = engine.plan(requestId, request);
        ConsoleOutput.plan(plan);
        if (!run) {
            return;
        }

        ConsoleOutput.rule();
        StreamSink sink = ClassifyCommand::print;
        engine.execute(plan, request)
                .doOnNext(sink::accept)
                .blockLast(Duration.ofMinutes(30));
        System.out.println();
    }

    private static void print(StreamEvent event) {
        if (event instanceof StreamEvent.ContentDelta content) {
            System.out.print(content.text());
        } else if (event instanceof StreamEvent.ReasoningDelta reasoning) {
            ConsoleOutput.reasoning(reasoning.text());
        } else if (event instanceof StreamEvent.Done done) {
            System.out.println();
            ConsoleOutput.success("finish_reason=" + done.finishReason());
        } else if (event instanceof StreamEvent.Error error) {
            System.out.println();
            ConsoleOutput.error(error.kind() + ": " + error.message());
        }
    }
}

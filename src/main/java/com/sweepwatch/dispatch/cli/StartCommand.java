package com.sweepwatch.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * CLI command: sweepwatch start &lt;freq&gt;... [--unit MHz] [--span 20] [--cycle-time 10]
 */
@Command(name = "start", mixinStandardHelpOptions = true, description = "Start sweeping one or more frequencies")
@Component
public class StartCommand extends ServerCommand {

    @Parameters(arity = "1..*", paramLabel = "FREQ", description = "Center frequencies")
    private List<Double> frequencies;

    @Option(names = {"--unit", "-u"}, description = "Frequency unit: Hz, kHz, MHz, GHz (default: ${DEFAULT-VALUE})",
            defaultValue = "MHz")
    private String unit;

    @Option(names = {"--span", "-s"}, description = "Span around each center in MHz")
    private Double spanMhz;

    @Option(names = {"--bin-width", "-w"}, description = "FFT bin width in Hz")
    private Integer binWidthHz;

    @Option(names = {"--cycle-time", "-c"}, description = "Seconds spent on each frequency")
    private Double cycleTimeSeconds;

    public StartCommand(SweepApiClient client) {
        super(client);
    }

    @Override
    protected void execute() throws IOException, InterruptedException {
        List<Map<String, Object>> entries = new ArrayList<>();
        for (Double frequency : frequencies) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("value", frequency);
            entry.put("unit", unit);
            if (spanMhz != null) {
                entry.put("spanMhz", spanMhz);
            }
            if (binWidthHz != null) {
                entry.put("binWidthHz", binWidthHz);
            }
            entries.add(entry);
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("frequencies", entries);
        if (cycleTimeSeconds != null) {
            body.put("cycleTime", cycleTimeSeconds);
        }

        var response = client.post(SweepApiClient.SWEEP_PATH + "/start", body);
        if (response.ok()) {
            ConsoleOutput.success("Sweep accepted: " + response.text("frequencies") + " frequency(ies), "
                    + ConsoleOutput.formatDuration(response.body().path("cycleTimeMs").asLong()) + " per frequency");
            ConsoleOutput.phase(response.text("state"));
        } else if (response.body().hasNonNull("reason")) {
            ConsoleOutput.error("Start rejected (" + response.text("reason") + "): " + response.text("message"));
        } else {
            printFailure(response);
        }
    }
}

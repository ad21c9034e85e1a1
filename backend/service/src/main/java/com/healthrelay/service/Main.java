package com.healthrelay.service;

import com.healthrelay.alerting.alertmanager.AlertmanagerAlertProvider;
import com.healthrelay.alerting.api.HttpClientProvider;
import com.healthrelay.alerting.exception.AlertingException;
import com.healthrelay.alerting.exception.OverrideParseException;
import com.healthrelay.alerting.exception.ProviderConfigException;
import com.healthrelay.core.model.AlertDefinition;
import com.healthrelay.core.model.CheckResult;
import com.healthrelay.core.model.Endpoint;
import com.healthrelay.service.config.AlertingConfigLoader;
import com.healthrelay.service.http.SharedHttpClients;

import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());
    static final String USAGE =
            "Usage: Main <config.yaml> <endpoint-name> <endpoint-url> [--group=<group>] [--error=<message>]... [--resolved]";

    private Main() {
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err, new SharedHttpClients()));
    }

    static int run(String[] args, PrintStream out, PrintStream err, HttpClientProvider httpClients) {
        List<String> positional = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        String group = "";
        boolean resolved = false;
        for (String arg : args) {
            if (arg.equals("--resolved")) {
                resolved = true;
            } else if (arg.startsWith("--group=")) {
                group = arg.substring("--group=".length());
            } else if (arg.startsWith("--error=")) {
                errors.add(arg.substring("--error=".length()));
            } else if (arg.startsWith("--")) {
                err.println("Unknown option: " + arg);
                out.println(USAGE);
                return 1;
            } else {
                positional.add(arg);
            }
        }
        if (positional.size() != 3) {
            out.println(USAGE);
            return 1;
        }

        AlertmanagerAlertProvider provider;
        try {
            provider = AlertingConfigLoader.loadAlertmanager(Path.of(positional.get(0)), httpClients);
        } catch (IllegalStateException e) {
            err.println(e.getMessage());
            return 2;
        }

        Endpoint endpoint = new Endpoint(positional.get(1), group, positional.get(2));
        AlertDefinition alert = AlertDefinition.empty().withDefaults(provider.defaultAlert());
        CheckResult result = resolved
                ? CheckResult.healthy(200, Clock.systemUTC().instant())
                : CheckResult.failed(errors, Clock.systemUTC().instant());

        try {
            provider.send(endpoint, alert, result, resolved);
        } catch (ProviderConfigException | OverrideParseException e) {
            err.println("Configuration error: " + e.getMessage());
            return 2;
        } catch (AlertingException e) {
            LOGGER.log(Level.WARNING, "Alert delivery failed for " + endpoint.displayName(), e);
            err.println("Delivery failed: " + e.getMessage());
            return 3;
        }

        out.println((resolved ? "Resolved" : "Firing") + " alert sent for " + endpoint.displayName());
        return 0;
    }
}

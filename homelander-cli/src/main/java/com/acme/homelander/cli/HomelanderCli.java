package com.acme.homelander.cli;

import com.acme.homelander.cli.commands.FulfillmentCommands;
import picocli.CommandLine;
import picocli.CommandLine.Command;

@Command(
        name = "homelander",
        description = "Homelander - smart home fulfillment against an in-memory demo home",
        mixinStandardHelpOptions = true,
        version = "1.0.0",
        subcommands = {
                FulfillmentCommands.Fulfill.class,
                FulfillmentCommands.Sync.class,
                FulfillmentCommands.Query.class,
                FulfillmentCommands.Execute.class,
                FulfillmentCommands.Devices.class
        }
)
public class HomelanderCli implements Runnable {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new HomelanderCli()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public void run() {
        // no subcommand: show help
        CommandLine.usage(this, System.out);
    }
}

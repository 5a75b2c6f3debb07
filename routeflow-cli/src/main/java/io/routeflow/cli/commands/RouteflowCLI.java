package io.routeflow.cli.commands;

import io.quarkus.picocli.runtime.annotations.TopCommand;
import picocli.CommandLine.Command;

/// Main entry point for the Routeflow CLI application.
///
/// Subcommands:
/// - `validate` - Check flow structure and report errors and warnings
/// - `simulate` - Walk a flow with test variables and print the trace
/// - `import` - Turn external rule documents into flow files
/// - `export` - Turn flow files back into external rule documents
/// - `variables` - List the test variables a flow's conditions reference
///
/// @see FlowValidateCommand
/// @see FlowSimulateCommand
/// @see RuleImportCommand
/// @see RuleExportCommand
/// @see FlowVariablesCommand
@TopCommand
@Command(
        name = "routeflow",
        mixinStandardHelpOptions = true,
        description = "Routeflow routing flow validator and simulator",
        subcommands = {
            FlowValidateCommand.class,
            FlowSimulateCommand.class,
            RuleImportCommand.class,
            RuleExportCommand.class,
            FlowVariablesCommand.class
        })
public class RouteflowCLI {}

package org.blockindex.migrations;

import org.blockindex.migrations.aws.AwsClients;
import org.blockindex.migrations.pipeline.ir.ScanCursor;
import org.blockindex.migrations.pipeline.ir.ScanPartition;
import org.blockindex.migrations.pipeline.scan.ScanControl;

/**
 * Operator commands for a migration, configured from the same environment as the functions.
 */
public class ScanControlMain {

    private static final String USAGE = String.join(System.lineSeparator(),
        "Usage: ScanControlMain <command>",
        "  launch <totalPartitions>",
        "  stop",
        "  stop-partition <totalPartitions> <partitionId>",
        "  progress <totalPartitions> <partitionId>");

    public static void main(String[] args) {
        if (args.length < 1) {
            System.err.println(USAGE);
            System.exit(1);
        }
        var config = MigrationConfig.fromEnvironment();
        try (var clients = AwsClients.create(config)) {
            var control = ScannerFunction.create(config, clients).control();
            System.out.println(run(control, args));
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(USAGE);
            System.exit(1);
        }
    }

    static String run(ScanControl control, String[] args) {
        switch (args[0]) {
            case "launch":
                requireArgs(args, 2);
                return "Launched " + control.launch(Integer.parseInt(args[1])).block() + " partitions";
            case "stop":
                control.requestStop().block();
                return "Stop signal set";
            case "stop-partition":
                requireArgs(args, 3);
                return describe(control.requestPartitionStop(partition(args)).block());
            case "progress":
                requireArgs(args, 3);
                return describe(control.progress(partition(args)).block());
            default:
                throw new IllegalArgumentException("Unknown command: " + args[0]);
        }
    }

    private static ScanPartition partition(String[] args) {
        return new ScanPartition(Integer.parseInt(args[1]), Integer.parseInt(args[2]));
    }

    private static void requireArgs(String[] args, int count) {
        if (args.length < count) {
            throw new IllegalArgumentException(args[0] + " needs " + (count - 1) + " argument(s)");
        }
    }

    static String describe(ScanCursor cursor) {
        return String.format("Partition %s: %d records scanned, %s%s",
            cursor.partition(),
            cursor.recordsScanned(),
            cursor.exhausted() ? "complete" : "in progress",
            cursor.stopRequested() ? ", stop requested" : "");
    }
}

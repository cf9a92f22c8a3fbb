package storagesizing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import storagesizing.config.ProblemConfiguration;
import storagesizing.config.ProblemConfigurationBuilder;
import storagesizing.config.SolverConfig;
import storagesizing.io.LpModelWriter;
import storagesizing.io.SizingResultsExcelWriter;
import storagesizing.model.SizingSolution;
import storagesizing.model.StorageSelectionProblem;

import java.time.Duration;

/**
 * Usage: Main [--days N] [--scenarios N] [--seed N] [--time-limit-seconds N] [--lp PATH] [--xlsx PATH]
 */
public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        try {
            RunSetup setup = parseArgs(args);
            run(setup.configuration(), setup.solverConfig());
        } catch (Exception e) {
            System.err.println("Ошибка: " + e.getMessage());
            log.error("run failed", e);
            System.exit(1);
        }
    }

    static SizingSolution run(ProblemConfiguration cfg, SolverConfig solverCfg) throws Exception {
        log.info("configuration: {}", cfg);

        try (StorageSelectionProblem problem = StorageSelectionProblem.create(cfg, solverCfg)) {
            problem.buildModel();

            System.out.println("Starting to solve problem. Problem characteristics:");
            System.out.println("variables: " + problem.getEngine().numVariables());
            System.out.println("constraints: " + problem.getEngine().numConstraints());

            if (solverCfg.getLpExportPath().isPresent()) {
                String lpPath = solverCfg.getLpExportPath().get();
                LpModelWriter.write(lpPath, problem.exportModelAsLp());
                log.info("LP model written to {}", lpPath);
            }

            SizingSolution solution = problem.solve();

            System.out.println("Status: " + solution.status);
            System.out.println("Modules: " + solution.numberOfModules);
            System.out.printf("Storage: %.3f kWh%n", solution.sizeOfStorageKwh);
            System.out.printf("Objective: %.2f EUR (investment %.2f + expected recourse %.2f)%n",
                    solution.objectiveValue, solution.investmentCost, solution.expectedRecourseCost);

            if (solverCfg.getXlsxReportPath().isPresent()) {
                String xlsxPath = solverCfg.getXlsxReportPath().get();
                SizingResultsExcelWriter.writeXlsx(xlsxPath, cfg, solverCfg, problem.getProfiles(), solution);
                System.out.println("Saved: " + xlsxPath);
            }
            return solution;
        }
    }

    static RunSetup parseArgs(String[] args) {
        ProblemConfigurationBuilder cfg = ProblemConfigurationBuilder.from(ProblemFactory.demoConfiguration());
        SolverConfig solverCfg = ProblemFactory.demoSolverConfig();

        for (int i = 0; i < args.length; i++) {
            String key = args[i];
            if (i + 1 >= args.length) {
                throw new IllegalArgumentException("Нет значения для " + key);
            }
            String value = args[++i];
            switch (key) {
                case "--days" -> cfg.setNumberOfDays(parseInt(key, value));
                case "--scenarios" -> cfg.setNumberOfScenarios(parseInt(key, value));
                case "--seed" -> solverCfg = solverCfg.withBaseSeed(parseLong(key, value));
                case "--time-limit-seconds" ->
                        solverCfg = solverCfg.withTimeLimit(Duration.ofSeconds(parseLong(key, value)));
                case "--lp" -> solverCfg = solverCfg.withLpExportPath(value);
                case "--xlsx" -> solverCfg = solverCfg.withXlsxReportPath(value);
                default -> throw new IllegalArgumentException("Unknown option: " + key);
            }
        }
        return new RunSetup(cfg.build(), solverCfg);
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " ожидает целое число, получено " + value, e);
        }
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " ожидает целое число, получено " + value, e);
        }
    }

    record RunSetup(ProblemConfiguration configuration, SolverConfig solverConfig) {}
}

package storagesizing.io;

import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import storagesizing.config.ProblemConfiguration;
import storagesizing.config.ProblemConfigurationBuilder;
import storagesizing.config.SolverConfig;
import storagesizing.model.OperationalField;
import storagesizing.model.SizingSolution;
import storagesizing.model.StorageSelectionProblem;

import java.io.File;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SizingResultsExcelWriterTest {

    @TempDir
    Path dir;

    @Test
    void writesSummaryAndOneHourlySheetPerScenario() throws Exception {
        ProblemConfiguration cfg = new ProblemConfigurationBuilder()
                .setNumberOfScenarios(2)
                .setNumberOfDays(1)
                .setMaxNumberOfModules(20)
                .setMaxStorageSizeKwh(20)
                .setStoragePricePerKwhEuro(10)
                .setPricePerModuleEuro(5)
                .build();
        SolverConfig solverCfg = SolverConfig.defaults().withBaseSeed(77L);
        File out = dir.resolve("sizing.xlsx").toFile();

        SizingSolution solution;
        try (StorageSelectionProblem problem = StorageSelectionProblem.create(cfg, solverCfg)) {
            problem.buildModel();
            solution = problem.solve();
            SizingResultsExcelWriter.writeXlsx(out.getPath(), cfg, solverCfg, problem.getProfiles(), solution);
        }

        try (Workbook wb = WorkbookFactory.create(out)) {
            assertThat(wb.getNumberOfSheets()).isEqualTo(3);
            assertThat(wb.getSheetName(0)).isEqualTo(SizingResultsExcelWriter.SUMMARY_SHEET);
            assertThat(wb.getSheetName(1)).isEqualTo("S1");
            assertThat(wb.getSheetName(2)).isEqualTo("S2");

            Sheet summary = wb.getSheet(SizingResultsExcelWriter.SUMMARY_SHEET);
            assertThat(summary.getRow(0).getCell(0).getStringCellValue())
                    .contains("solver=SCIP")
                    .contains("seed=77")
                    .contains("S=2");
            assertThat(summary.getRow(2).getCell(1).getStringCellValue()).isEqualTo(solution.status.name());
            assertThat(summary.getRow(3).getCell(1).getNumericCellValue()).isEqualTo(solution.numberOfModules);

            Sheet hourly = wb.getSheet(SizingResultsExcelWriter.scenarioSheetName(1));
            assertThat(hourly.getLastRowNum()).isEqualTo(24);
            Row header = hourly.getRow(0);
            assertThat(header.getCell(0).getStringCellValue()).isEqualTo("t");
            assertThat(header.getCell(5).getStringCellValue()).isEqualTo("storageLevelWh");

            int boughtCol = 5 + OperationalField.BOUGHT_ENERGY.ordinal();
            Row hour7 = hourly.getRow(8);
            assertThat(hour7.getCell(0).getNumericCellValue()).isEqualTo(7.0);
            assertThat(hour7.getCell(boughtCol).getNumericCellValue())
                    .isCloseTo(solution.value(1, 7, OperationalField.BOUGHT_ENERGY), within(1e-9));
        }
    }
}

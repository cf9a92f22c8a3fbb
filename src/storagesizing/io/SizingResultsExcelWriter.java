package storagesizing.io;

import org.apache.poi.ss.usermodel.*;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import storagesizing.config.ProblemConfiguration;
import storagesizing.config.SolverConfig;
import storagesizing.model.OperationalField;
import storagesizing.model.SizingSolution;
import storagesizing.sampling.ScenarioProfile;

import java.io.FileOutputStream;
import java.io.IOException;
import java.util.List;

/**
 * xlsx-отчёт: лист SUMMARY с паспортом и итогом, плюс почасовой лист на каждый сценарий.
 */
public final class SizingResultsExcelWriter {

    static final String SUMMARY_SHEET = "SUMMARY";

    private SizingResultsExcelWriter() {}

    public static String scenarioSheetName(int scenario) {
        return "S" + (scenario + 1);
    }

    public static void writeXlsx(String path,
                                 ProblemConfiguration cfg,
                                 SolverConfig solverCfg,
                                 List<ScenarioProfile> profiles,
                                 SizingSolution solution) throws IOException {

        if (profiles.size() != solution.getScenarioCount()) {
            throw new IllegalArgumentException("profiles.size != solution.scenarioCount");
        }

        try (Workbook wb = new XSSFWorkbook()) {

            // ===== Styles =====
            DataFormat df = wb.createDataFormat();

            CellStyle headerStyle = wb.createCellStyle();
            headerStyle.setAlignment(HorizontalAlignment.CENTER);
            headerStyle.setVerticalAlignment(VerticalAlignment.CENTER);

            CellStyle numberStyle = wb.createCellStyle();
            numberStyle.setAlignment(HorizontalAlignment.CENTER);
            numberStyle.setDataFormat(df.getFormat("0.00"));

            // цены - до десятых цента
            CellStyle priceStyle = wb.createCellStyle();
            priceStyle.setAlignment(HorizontalAlignment.CENTER);
            priceStyle.setDataFormat(df.getFormat("0.0000"));

            CellStyle intStyle = wb.createCellStyle();
            intStyle.setAlignment(HorizontalAlignment.CENTER);
            intStyle.setDataFormat(df.getFormat("0"));

            // ===== SUMMARY =====
            Sheet summary = wb.createSheet(SUMMARY_SHEET);
            int r = 0;

            Row passport = summary.createRow(r++);
            passport.createCell(0).setCellValue(buildPassport(cfg, solverCfg));

            r++;
            r = writePair(summary, r, "status", solution.status.name(), headerStyle);
            r = writePair(summary, r, "numberOfModules", solution.numberOfModules, intStyle, headerStyle);
            r = writePair(summary, r, "sizeOfStorageKwh", solution.sizeOfStorageKwh, numberStyle, headerStyle);
            r = writePair(summary, r, "objectiveEuro", solution.objectiveValue, numberStyle, headerStyle);
            r = writePair(summary, r, "investmentEuro", solution.investmentCost, numberStyle, headerStyle);
            r = writePair(summary, r, "expectedRecourseEuro", solution.expectedRecourseCost, numberStyle, headerStyle);

            r++;
            Row hdr = summary.createRow(r++);
            writeHeader(hdr, 0, "scenario", headerStyle);
            writeHeader(hdr, 1, "recourseEuro", headerStyle);
            for (int s = 0; s < solution.getScenarioCount(); s++) {
                Row row = summary.createRow(r++);
                writeInt(row, 0, s + 1, intStyle);
                writeNumber(row, 1, solution.scenarioRecourseCost(s), numberStyle);
            }
            summary.setColumnWidth(0, 24 * 256);
            summary.setColumnWidth(1, 16 * 256);

            // ===== per-scenario hourly sheets =====
            for (int s = 0; s < solution.getScenarioCount(); s++) {
                writeScenarioSheet(wb.createSheet(scenarioSheetName(s)), profiles.get(s), solution, s,
                        headerStyle, numberStyle, priceStyle, intStyle);
            }

            try (FileOutputStream out = new FileOutputStream(path)) {
                wb.write(out);
            }
        }
    }

    private static void writeScenarioSheet(Sheet sh,
                                           ScenarioProfile profile,
                                           SizingSolution solution,
                                           int s,
                                           CellStyle headerStyle,
                                           CellStyle numberStyle,
                                           CellStyle priceStyle,
                                           CellStyle intStyle) {
        Row hdr = sh.createRow(0);
        int c = 0;
        c = writeHeader(hdr, c, "t", headerStyle);
        c = writeHeader(hdr, c, "solarW_perModule", headerStyle);
        c = writeHeader(hdr, c, "loadW", headerStyle);
        c = writeHeader(hdr, c, "buyPrice", headerStyle);
        c = writeHeader(hdr, c, "sellPrice", headerStyle);
        for (OperationalField f : OperationalField.values()) {
            c = writeHeader(hdr, c, f.fieldName() + "Wh", headerStyle);
        }

        for (int t = 0; t < solution.getTimeslotCount(); t++) {
            Row row = sh.createRow(t + 1);
            int cc = 0;
            writeInt(row, cc++, t, intStyle);
            writeNumber(row, cc++, profile.solarWattsPerModule(t), numberStyle);
            writeNumber(row, cc++, profile.consumptionW(t), numberStyle);
            writeNumber(row, cc++, profile.purchasePricePerKwh(t), priceStyle);
            writeNumber(row, cc++, profile.sellPricePerKwh(t), priceStyle);
            for (OperationalField f : OperationalField.values()) {
                writeNumber(row, cc++, solution.value(s, t, f), numberStyle);
            }
        }

        sh.createFreezePane(1, 1);
        for (int i = 0; i < c; i++) sh.setColumnWidth(i, 18 * 256);
    }

    private static int writePair(Sheet sh, int r, String key, String value, CellStyle headerStyle) {
        Row row = sh.createRow(r);
        writeHeader(row, 0, key, headerStyle);
        row.createCell(1).setCellValue(value);
        return r + 1;
    }

    private static int writePair(Sheet sh, int r, String key, double value, CellStyle numStyle, CellStyle headerStyle) {
        Row row = sh.createRow(r);
        writeHeader(row, 0, key, headerStyle);
        writeNumber(row, 1, value, numStyle);
        return r + 1;
    }

    private static int writeHeader(Row hdr, int col, String text, CellStyle headerStyle) {
        Cell cell = hdr.createCell(col);
        cell.setCellValue(text);
        cell.setCellStyle(headerStyle);
        return col + 1;
    }

    private static void writeNumber(Row row, int col, double value, CellStyle numStyle) {
        Cell cell = row.createCell(col);
        cell.setCellValue(value);
        cell.setCellStyle(numStyle);
    }

    private static void writeInt(Row row, int col, long value, CellStyle intStyle) {
        Cell cell = row.createCell(col);
        cell.setCellValue(value);
        cell.setCellStyle(intStyle);
    }

    private static String buildPassport(ProblemConfiguration cfg, SolverConfig solverCfg) {
        return String.format(
                "solver=%s; seed=%d; S=%d; days=%d; modules=[%d..%d]x%.0fW@%.0fEUR; area=%.2fm2; storage=[%.1f..%.1f]kWh@%.0fEUR",
                solverCfg.getSolverId(),
                solverCfg.getBaseSeed(),
                cfg.getNumberOfScenarios(),
                cfg.getNumberOfDays(),
                cfg.getMinNumberOfModules(),
                cfg.getMaxNumberOfModules(),
                cfg.getMaxWattsPerModule(),
                cfg.getPricePerModuleEuro(),
                cfg.getAreaPerModuleM2(),
                cfg.getMinStorageSizeKwh(),
                cfg.getMaxStorageSizeKwh(),
                cfg.getStoragePricePerKwhEuro()
        );
    }
}

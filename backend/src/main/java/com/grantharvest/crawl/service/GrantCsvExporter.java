package com.grantharvest.crawl.service;

import com.grantharvest.crawl.model.Grant;
import com.grantharvest.crawl.model.StoredGrant;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.TreeSet;

@Component
public class GrantCsvExporter {
    static final String[] HEADER = {
        "id",
        "issuer",
        "title",
        "cash_prize",
        "entry_fee",
        "deadline",
        "genres",
        "description",
        "read_more_link",
        "extra_info"
    };

    public int export(List<StoredGrant> grants, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            return write(grants, writer);
        }
    }

    public int write(List<StoredGrant> grants, Writer writer) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader(HEADER)
            .build();
        int rows = 0;
        try (CSVPrinter printer = new CSVPrinter(writer, format)) {
            for (StoredGrant stored : grants) {
                Grant grant = stored.grant();
                printer.printRecord(
                    stored.id(),
                    grant.issuer(),
                    grant.title(),
                    grant.cashPrize(),
                    grant.entryFee(),
                    grant.deadline(),
                    String.join(", ", new TreeSet<>(stored.genres())),
                    grant.description(),
                    grant.readMoreLink(),
                    grant.extraInfo()
                );
                rows++;
            }
        }
        return rows;
    }
}

package com.e2eq.dats.queries;

import com.e2eq.dats.core.JoinResult;
import com.e2eq.dats.core.Triple;
import com.e2eq.dats.core.TripleIndex;
import com.e2eq.dats.queries.model.DatasetVariable;
import com.e2eq.dats.queries.model.SecondLevelDataset;
import com.e2eq.dats.queries.model.StudyGroupMember;
import org.supercsv.encoder.CsvEncoder;
import org.supercsv.encoder.DefaultCsvEncoder;
import org.supercsv.io.CsvListWriter;
import org.supercsv.io.ICsvListWriter;
import org.supercsv.prefs.CsvPreference;
import org.supercsv.util.CsvContext;

import java.io.IOException;
import java.io.Writer;
import java.util.*;

/**
 * Renders query results as tab-delimited report sections:
 * an empty line, the title, an empty line, the header row, one line per row and a closing empty line.
 */
public class QueryReportWriter {

    static final CsvPreference TAB_DELIMITED = new CsvPreference.Builder('"', '\t', "\n")
            .useEncoder(new LineSafeEncoder())
            .build();

    private static final String[] VARIABLE_HEADER = {"dbGaP Study", "dbGaP variable", "Name", "Description"};
    private static final String[] PARTS_HEADER = {"Parent dataset", "Dataset", "Title"};
    private static final String[] MEMBER_HEADER = {"Dataset", "Study group", "Member"};
    private static final String[] TRIPLE_HEADER = {"Subject", "Predicate", "Object"};

    /**
     * @param datasetId the accession the query was restricted to, or null
     */
    public void writeDatasetVariables(Writer out, List<DatasetVariable> variables, String datasetId) throws IOException {
        String title = "Dataset variables" + (datasetId != null ? " for dataset " + datasetId : "") + ":";
        List<List<String>> rows = new ArrayList<>(variables.size());
        for (DatasetVariable v : variables) {
            rows.add(Arrays.asList(v.getStudy(), v.getVariableId(), v.getName(), v.getDescription()));
        }
        writeSection(out, title, VARIABLE_HEADER, rows);
    }

    public void writeSecondLevelDatasets(Writer out, List<SecondLevelDataset> datasets) throws IOException {
        List<List<String>> rows = new ArrayList<>(datasets.size());
        for (SecondLevelDataset d : datasets) {
            rows.add(Arrays.asList(d.getParentId(), d.getDatasetId(), d.getTitle()));
        }
        writeSection(out, "2nd-level datasets:", PARTS_HEADER, rows);
    }

    public void writeStudyGroupMembers(Writer out, List<StudyGroupMember> members, String datasetId, String groupName)
            throws IOException {
        List<List<String>> rows = new ArrayList<>(members.size());
        for (StudyGroupMember m : members) {
            rows.add(Arrays.asList(m.getDatasetId(), m.getGroupName(), m.getMemberName()));
        }
        writeSection(out, "Study group members for dataset " + datasetId + ", study group " + groupName + ":",
                MEMBER_HEADER, rows);
    }

    /**
     * Generic section for any join result; the column labels form the header.
     */
    public void writeResult(Writer out, String title, JoinResult result) throws IOException {
        writeSection(out, title, result.columns().toArray(new String[0]), result.rows());
    }

    /**
     * Dumps every triple of the index, sorted by subject, predicate and object.
     */
    public void writeTriples(Writer out, TripleIndex index) throws IOException {
        List<Triple> sorted = new ArrayList<>(index.triples());
        sorted.sort(Comparator.comparing(Triple::subject)
                .thenComparing(Triple::predicate)
                .thenComparing(Triple::object));
        List<List<String>> rows = new ArrayList<>(sorted.size());
        for (Triple t : sorted) {
            rows.add(Arrays.asList(t.subject(), t.predicate(), t.object()));
        }
        writeSection(out, "Tabular dump:", TRIPLE_HEADER, rows);
    }

    private void writeSection(Writer out, String title, String[] header, List<List<String>> rows) throws IOException {
        out.write("\n" + title + "\n\n");
        // not closed: closing would close the caller's writer
        ICsvListWriter csv = new CsvListWriter(out, TAB_DELIMITED);
        csv.writeHeader(header);
        for (List<String> row : rows) {
            csv.write(row);
        }
        csv.flush();
        out.write("\n");
        out.flush();
    }

    /**
     * Writes values verbatim; only a value that would break the line structure (a tab or a line break)
     * is quoted.
     */
    static final class LineSafeEncoder implements CsvEncoder {
        private final DefaultCsvEncoder quoting = new DefaultCsvEncoder();

        @Override
        public String encode(String input, CsvContext context, CsvPreference preference) {
            if (input.indexOf('\t') < 0 && input.indexOf('\n') < 0 && input.indexOf('\r') < 0) {
                return input;
            }
            return quoting.encode(input, context, preference);
        }
    }
}

package argumentation.cli;

import argumentation.enumerate.EnumerationResult;
import argumentation.model.ArgumentationFramework;
import argumentation.model.Extension;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

final class JsonReportBuilder {
  private static final String VERSION = "1.0.0";
  private final Gson gson = new GsonBuilder().setPrettyPrinting().create();

  String solveReport(
      CliOptions options, ArgumentationFramework af, boolean answer, long elapsedMillis) {
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("meta", meta(options, af, elapsedMillis));
    root.put("problem", options.problem().code());
    root.put("arguments", sortedList(options.arguments()));
    root.put("answer", ResultFormatter.yesNo(answer));
    return gson.toJson(root);
  }

  String extensionsReport(CliOptions options, ArgumentationFramework af, EnumerationResult result) {
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("meta", meta(options, af, result.elapsedMillis()));
    root.put("semantics", result.semantics().name());
    root.put("subsets_examined", result.subsetsExamined());
    root.put("count", result.size());
    List<List<String>> extensions = new ArrayList<>(result.size());
    for (Extension extension : result.extensions()) {
      extensions.add(extension.members());
    }
    root.put("extensions", extensions);
    return gson.toJson(root);
  }

  private Map<String, Object> meta(
      CliOptions options, ArgumentationFramework af, long elapsedMillis) {
    Map<String, Object> meta = new LinkedHashMap<>();
    meta.put("version", VERSION);
    meta.put("file", options.file().toString());
    meta.put("time_ms", elapsedMillis);
    meta.put("argument_count", af.size());
    meta.put("attack_count", af.attackCount());
    meta.put("parallel", options.solverOptions().parallel());
    return meta;
  }

  private List<String> sortedList(Set<String> values) {
    return values.stream().sorted().toList();
  }
}

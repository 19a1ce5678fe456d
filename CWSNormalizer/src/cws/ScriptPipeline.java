package cws;

import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;

/**
 * Tokenizer, parser, transformer and formatter wired together for one vocabulary, schema and set
 * of formatter options. A pipeline holds no per-document state, so one instance may serve any
 * number of documents, from any number of threads.
 */
public final class ScriptPipeline {
  private static final Logger LOG = LoggerFactory.getLogger(ScriptPipeline.class);

  /** Everything produced for one document. */
  @AutoValue
  public abstract static class Result {
    public abstract Node.Block parseTree();

    public abstract Document document();

    public abstract String text();

    static Result create(Node.Block parseTree, Document document, String text) {
      return new AutoValue_ScriptPipeline_Result(parseTree, document, text);
    }
  }

  private final Vocabulary vocabulary;
  private final NodeTransformer transformer;
  private final Formatter formatter;

  public ScriptPipeline(Vocabulary vocabulary, DocumentSchema schema, FormatterOptions options) {
    this.vocabulary = Preconditions.checkNotNull(vocabulary);
    this.transformer = new NodeTransformer(vocabulary, schema);
    this.formatter = new Formatter(options);
  }

  public ImmutableList<Tokenizer.Token> tokenize(String file, String text) throws LexException {
    Stopwatch stopwatch = Stopwatch.createStarted();
    ImmutableList<Tokenizer.Token> tokens = new Tokenizer(file, text, vocabulary).tokenize();
    LOG.debug(
        "{}: {} tokens in {} ms", file, tokens.size(), stopwatch.elapsed(TimeUnit.MILLISECONDS));
    return tokens;
  }

  public Node.Block parse(String file, String text) throws LexException, ParseException {
    ImmutableList<Tokenizer.Token> tokens = tokenize(file, text);

    Stopwatch stopwatch = Stopwatch.createStarted();
    Node.Block root = new Parser(tokens).parse();
    LOG.debug(
        "{}: {} top-level nodes in {} ms",
        file,
        root.children().size(),
        stopwatch.elapsed(TimeUnit.MILLISECONDS));
    return root;
  }

  public Document normalize(Node.Block root) throws TransformException {
    Stopwatch stopwatch = Stopwatch.createStarted();
    Document document = transformer.normalize(root);
    LOG.debug(
        "{}: normalized {} top-level keys in {} ms",
        document.file(),
        document.root().entries().size(),
        stopwatch.elapsed(TimeUnit.MILLISECONDS));
    return document;
  }

  public String format(Document document) throws FormatException {
    Stopwatch stopwatch = Stopwatch.createStarted();
    String text = formatter.format(document);
    LOG.debug(
        "{}: formatted {} chars in {} ms",
        document.file(),
        text.length(),
        stopwatch.elapsed(TimeUnit.MILLISECONDS));
    return text;
  }

  /**
   * Runs every stage on one document.
   *
   * @throws ScriptException from the first stage that fails; nothing is produced in that case
   */
  public Result run(String file, String text) throws ScriptException {
    Node.Block root = parse(file, text);
    Document document = normalize(root);
    return Result.create(root, document, format(document));
  }

  /** The canonical text of a document. */
  public String normalizeText(String file, String text) throws ScriptException {
    return run(file, text).text();
  }
}

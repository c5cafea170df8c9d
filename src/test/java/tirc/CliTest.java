package tirc;

import static java.lang.String.format;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import com.google.common.collect.ImmutableMap;
import com.google.common.jimfs.Jimfs;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystem;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.io.output.ByteArrayOutputStream;
import org.junit.Before;
import org.junit.Test;

public class CliTest {

  ByteArrayOutputStream out;
  ByteArrayOutputStream err;
  FileSystem fs;
  Cli cli;

  @Before
  public void setup() {
    out = new ByteArrayOutputStream();
    err = new ByteArrayOutputStream();
    fs = Jimfs.newFileSystem();
    cli = new Cli(out, err, fs);
  }

  private Path file(String content) throws Exception {
    Path file = fs.getPath("file");
    Files.write(file, content.getBytes(StandardCharsets.US_ASCII));
    return file;
  }

  @Test
  public void fileDoesNotExist_printErrorMessageAndSignalFailure() throws Exception {
    String filename = "non-existing-file";
    int status = cli.run("--echo", filename);
    assertThat(status, is(not(0)));
    assertThat(err.toString(), allOf(containsString(filename), containsString("doesn't exist")));
  }

  @Test
  public void multipleMainArguments_printUsageAndSignalFailure() throws Exception {
    int status = cli.run("--print-tir", "foo", "bar");
    assertThat(status, is(not(0)));
    assertThat(err.toString(), containsString(Cli.usage));
  }

  @Test
  public void noFile_printUsageAndSignalFailure() throws Exception {
    int status = cli.run("--lextest");
    assertThat(status, is(not(0)));
    assertThat(err.toString(), containsString(Cli.usage));
  }

  @Test
  public void unknownOption_printUsageAndSignalFailure() throws Exception {
    int status = cli.run("--interpret", "file");
    assertThat(status, is(not(0)));
    assertThat(err.toString(), containsString(Cli.usage));
  }

  @Test
  public void bothPrintTirAndLextestOptionSet_printUsageAndSignalFailure() throws Exception {
    Path file = file("");
    int status = cli.run("--lextest", "--print-tir", file.toString());
    assertThat(status, is(not(0)));
    assertThat(err.toString(), containsString(Cli.usage));
  }

  @Test
  public void helpAndInvalidOptionCombinationIsSet_printUsageAndSignalSuccess() throws Exception {
    int status = cli.run("--lextest", "--help", "--echo", "arg1", "arg2");
    assertThat(status, is(0));
    assertThat(out.toString(), containsString(Cli.usage));
  }

  @Test
  public void usage_listsEnvironmentVariables() throws Exception {
    assertThat(Cli.usage, containsString("TIRC_VERIFY"));
    assertThat(Cli.usage, containsString("TIRC_OUTPUTFILENAME"));
  }

  @Test
  public void echoFile_contentWasWrittenToOut() throws Exception {
    Path file = fs.getPath("file");
    byte[] content = {5, 123, 100, 58, 39, 69, 26};
    Files.write(file, content);
    int status = cli.run("--echo", file.toString());
    assertThat(status, is(0));
    assertThat(out.toByteArray(), equalTo(content));
  }

  @Test
  public void lextestFile_tokensAreWrittenToOut() throws Exception {
    Path file = file("$read x # comment\n:= x 01");
    int status = cli.run("--lextest", file.toString());
    assertThat(status, is(0));
    assertThat(
        out.toString(),
        equalTo(
            format("$read%nidentifier x%n:=%nidentifier x%ninteger literal 01%nEOF%n")));
  }

  @Test
  public void parsetestValidFile_noOutputAndSignalSuccess() throws Exception {
    Path file = file("$read x $if x {$print x} {}");
    int status = cli.run("--parsetest", file.toString());
    assertThat(status, is(0));
    assertThat(out.toString(), is(""));
  }

  @Test
  public void parsetestInvalidFile_errorPointsAtOffendingToken() throws Exception {
    Path file = file("$read x\n$print + x");
    int status = cli.run("--parsetest", file.toString());
    assertThat(status, is(not(0)));
    assertThat(
        err.toString(),
        allOf(
            startsWith("error: "),
            containsString("reached the end of input"),
            containsString("2| $print + x")));
  }

  @Test
  public void lexerError_reportedWithSourceExcerpt() throws Exception {
    Path file = file(":= x ?");
    int status = cli.run(file.toString());
    assertThat(status, is(not(0)));
    assertThat(
        err.toString(),
        allOf(containsString("Lexer error"), containsString(format("1| := x ?%n        ^"))));
  }

  @Test
  public void printAst_canonicalSourceIsWrittenToOut() throws Exception {
    Path file = file(":=x ~5 $if<x 0{$print x}{}");
    int status = cli.run("--print-ast", file.toString());
    assertThat(status, is(0));
    assertThat(out.toString(), equalTo(format(":= x ~ 5%n$if < x 0 {%n\t$print x%n} { }%n")));
  }

  @Test
  public void printTv_translationVectorIsWrittenToOut() throws Exception {
    Path file = file("$print 0");
    int status = cli.run("--print-tv", file.toString());
    assertThat(status, is(0));
    assertThat(
        out.toString(),
        equalTo(format("entry:%n    _const_1 = 0%n    print _const_1%n    exit%n")));
  }

  @Test
  public void noModeFlag_loweredProgramIsWrittenToOut() throws Exception {
    Path file = file(":= x + y 3");
    int status = cli.run(file.toString());
    assertThat(status, is(0));
    assertThat(
        out.toString(),
        equalTo(
            format(
                "declared: _const_1, _t_2, x, y%n"
                    + "entry:%n"
                    + "    _const_1 = 3%n"
                    + "    _t_2 = y + _const_1%n"
                    + "    x = _t_2%n"
                    + "    exit%n")));
  }

  @Test
  public void printTirWithIf_allFourBlocksAreWrittenToOut() throws Exception {
    Path file = file("$if x {$print 1} {}");
    int status = cli.run("--print-tir", "-v", "2", file.toString());
    assertThat(status, is(0));
    assertThat(
        out.toString(),
        equalTo(
            format(
                "declared: _const_1, x%n"
                    + "entry:%n"
                    + "    branch x lbl1 lbl2%n"
                    + "lbl1:%n"
                    + "    _const_1 = 1%n"
                    + "    print _const_1%n"
                    + "    jump lbl3%n"
                    + "lbl2:%n"
                    + "    jump lbl3%n"
                    + "lbl3:%n"
                    + "    exit%n")));
  }

  @Test
  public void outputFilenameSet_loweredProgramIsWrittenToThatFile() throws Exception {
    cli = new Cli(out, err, fs, ImmutableMap.of("TIRC_OUTPUTFILENAME", "out.tir")::get);
    Path file = file(":= x + y 3");
    int status = cli.run(file.toString());
    assertThat(status, is(0));
    assertThat(out.toString(), is(""));
    assertThat(
        new String(Files.readAllBytes(fs.getPath("out.tir")), StandardCharsets.UTF_8),
        equalTo(
            format(
                "declared: _const_1, _t_2, x, y%n"
                    + "entry:%n"
                    + "    _const_1 = 3%n"
                    + "    _t_2 = y + _const_1%n"
                    + "    x = _t_2%n"
                    + "    exit%n")));
  }

  @Test
  public void verifyUnset_verifierRunsAndItsErrorIsReported() throws Exception {
    cli.verifier =
        program -> {
          throw new TircError("rejected by verifier");
        };
    Path file = file("$print 1");
    int status = cli.run(file.toString());
    assertThat(status, is(not(0)));
    assertThat(err.toString(), containsString("rejected by verifier"));
  }

  @Test
  public void verifySetToZero_verifierIsSkipped() throws Exception {
    cli = new Cli(out, err, fs, ImmutableMap.of("TIRC_VERIFY", "0")::get);
    cli.verifier =
        program -> {
          throw new TircError("rejected by verifier");
        };
    Path file = file("$print 1");
    int status = cli.run(file.toString());
    assertThat(status, is(0));
    assertThat(err.toString(), is(""));
    assertThat(
        out.toString(),
        equalTo(
            format(
                "declared: _const_1%n"
                    + "entry:%n"
                    + "    _const_1 = 1%n"
                    + "    print _const_1%n"
                    + "    exit%n")));
  }

  @Test
  public void verifySetToOtherValue_verifierRuns() throws Exception {
    cli = new Cli(out, err, fs, ImmutableMap.of("TIRC_VERIFY", "1")::get);
    cli.verifier =
        program -> {
          throw new TircError("rejected by verifier");
        };
    int status = cli.run(file("$print 1").toString());
    assertThat(status, is(not(0)));
    assertThat(err.toString(), containsString("rejected by verifier"));
  }
}

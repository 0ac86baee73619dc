/* 
 * Copyright (C) 2018-present BC Cancer Genome Sciences Centre
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package seedbloom;

import java.io.PrintStream;
import java.io.PrintWriter;
import java.text.NumberFormat;
import java.util.LinkedHashSet;
import java.util.Random;
import java.util.Set;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import seedbloom.bloom.BloomFilter;
import static seedbloom.util.Common.convertToRoundedPercent;

/**
 * Command-line driver: builds a filter, adds and checks elements, and prints the
 * false positive rate estimate.
 */
public class SeedBloom {
    public final static String VERSION = "1.0.0";
    
    private final static String PROGRAM = "java -jar SeedBloom.jar";
    
    private final PrintStream out;
    
    public SeedBloom(PrintStream out) {
        this.out = out;
    }
    
    private int exitOnError(String msg) {
        out.println("ERROR: " + msg);
        return 1;
    }
    
    private int handleException(Exception ex) {
        out.println("ERROR: " + ex.getMessage());
        ex.printStackTrace(out);
        return 1;
    }
    
    public void printHelp(Options options) {
        printVersionInfo();
        out.println();
        
        HelpFormatter formatter = new HelpFormatter();
        formatter.setOptionComparator(null);
        PrintWriter pw = new PrintWriter(out);
        formatter.printHelp(pw, formatter.getWidth(), PROGRAM, null, options,
                formatter.getLeftPadding(), formatter.getDescPadding(), null, true);
        pw.flush();
    }
    
    public void printVersionInfo() {
        out.println("SeedBloom v" + VERSION);
    }
    
    private static Options buildOptions() {
        Options options = new Options();
        
        Option optSize = Option.builder("m")
                                    .longOpt("size")
                                    .desc("number of bits in the filter")
                                    .hasArg(true)
                                    .argName("INT")
                                    .build();
        options.addOption(optSize);
        
        Option optNumHash = Option.builder("k")
                                    .longOpt("hash")
                                    .desc("number of hash functions [" + BloomFilter.DEFAULT_NUM_HASH + "]")
                                    .hasArg(true)
                                    .argName("INT")
                                    .build();
        options.addOption(optNumHash);
        
        Option optAdd = Option.builder("a")
                                    .longOpt("add")
                                    .desc("element(s) to add")
                                    .hasArgs()
                                    .argName("STR")
                                    .build();
        options.addOption(optAdd);
        
        Option optCheck = Option.builder("c")
                                    .longOpt("check")
                                    .desc("element(s) to check")
                                    .hasArgs()
                                    .argName("STR")
                                    .build();
        options.addOption(optCheck);
        
        Option optNum = Option.builder("n")
                                    .longOpt("num")
                                    .desc("number of elements for the false positive rate estimate [number of distinct elements added]")
                                    .hasArg(true)
                                    .argName("INT")
                                    .build();
        options.addOption(optNum);
        
        Option optSeed = Option.builder("s")
                                    .longOpt("seed")
                                    .desc("seed of the random source for the hash seeds [random]")
                                    .hasArg(true)
                                    .argName("INT")
                                    .build();
        options.addOption(optSeed);
        
        Option optHelp = Option.builder("h")
                                    .longOpt("help")
                                    .desc("print this message and exit")
                                    .build();
        options.addOption(optHelp);
        
        Option optVersion = Option.builder("v")
                                    .longOpt("version")
                                    .desc("print version information and exit")
                                    .build();
        options.addOption(optVersion);
        
        return options;
    }
    
    /**
     * @return the exit status
     */
    public int run(String[] args) {
        CommandLineParser parser = new DefaultParser();
        Options options = buildOptions();
        
        CommandLine line;
        try {
            line = parser.parse(options, args);
        }
        catch (ParseException exp) {
            out.println("ERROR: " + exp.getMessage());
            printHelp(options);
            return 1;
        }
        
        if (line.hasOption("h")) {
            printHelp(options);
            return 0;
        }
        
        if (line.hasOption("v")) {
            printVersionInfo();
            return 0;
        }
        
        if (!line.hasOption("m")) {
            return exitOnError("Missing filter size (-m).");
        }
        
        try {
            final long size = Long.parseLong(line.getOptionValue("m"));
            final int numHash = Integer.parseInt(line.getOptionValue("k", Integer.toString(BloomFilter.DEFAULT_NUM_HASH)));
            final Random random = line.hasOption("s") ? new Random(Long.parseLong(line.getOptionValue("s"))) : new Random();
            
            BloomFilter bf = new BloomFilter(size, numHash, random);
            out.println("Bloom filter size: " + NumberFormat.getInstance().format(size) + " bits");
            out.println("Hash functions:    " + numHash);
            
            Set<String> added = new LinkedHashSet<>();
            String[] addValues = line.getOptionValues("a");
            if (addValues != null) {
                for (String key : addValues) {
                    bf.add(key);
                    added.add(key);
                }
            }
            out.println("Added " + NumberFormat.getInstance().format(added.size()) + " distinct elements.");
            
            String[] checkValues = line.getOptionValues("c");
            if (checkValues != null) {
                for (String key : checkValues) {
                    out.println(key + "\t" + bf.lookup(key));
                }
            }
            
            final long numElements = Long.parseLong(line.getOptionValue("n", Integer.toString(added.size())));
            out.println("Bits set:          " + NumberFormat.getInstance().format(bf.getPopCount()));
            out.println("Occupancy FPR:     " + convertToRoundedPercent(bf.getOccupancyFPR()) + " %");
            out.println(bf.describeFPR(numElements));
        }
        catch (NumberFormatException e) {
            return exitOnError("Not a number: " + e.getMessage());
        }
        catch (IllegalArgumentException e) {
            return handleException(e);
        }
        
        return 0;
    }
    
    /**
     * @param args the command line arguments
     */
    public static void main(String[] args) {
        int status = new SeedBloom(System.out).run(args);
        if (status != 0) {
            System.exit(status);
        }
    }
}

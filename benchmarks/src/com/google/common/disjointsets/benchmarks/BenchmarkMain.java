/*
 * Copyright 2024 Google Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.google.common.disjointsets.benchmarks;

import static java.util.concurrent.TimeUnit.SECONDS;

import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.options.ChainedOptionsBuilder;
import org.openjdk.jmh.runner.options.CommandLineOptions;
import org.openjdk.jmh.runner.options.OptionsBuilder;
import org.openjdk.jmh.runner.options.TimeValue;

/** A main() for disjoint set JMH benchmarks. */
public final class BenchmarkMain {
  private BenchmarkMain() {}

  public static void main(String[] argv) throws Exception {
    // Command line options may override the default values for number of iterations, time per
    // iteration, etc. which are provided as annotations on the @Benchmarks. If neither an
    // annotation nor a command line option specify a value, JMH built in defaults will apply.
    CommandLineOptions cmdLineOptions = new CommandLineOptions(argv);
    ChainedOptionsBuilder optionsBuilder = new OptionsBuilder().parent(cmdLineOptions);

    // If the command line options didn't set forks, set it to 1 here, as the default is 5.
    if (!cmdLineOptions.getForkCount().hasValue()) {
      optionsBuilder.forks(1);
    }
    // Similarly, if a timeout wasn't set, set it to 1 minute here, as the default is 10 minutes.
    if (!cmdLineOptions.getTimeout().hasValue()) {
      optionsBuilder.timeout(new TimeValue(60, SECONDS));
    }

    new Runner(optionsBuilder.build()).run();
  }
}

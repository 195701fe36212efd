/*
 * Copyright (c) 2015 LCMS Project Authors.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */

package net.larse.forestloss.landsat;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.Uninterruptibles;

import net.larse.forestloss.helper.AlgorithmBase;
import net.larse.forestloss.timeseries.Image;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeUnit;

/** Retries failed archive reads a bounded number of times with a growing pause. */
public class RetryingArchiveProvider implements ArchiveProvider {
  private static final Logger logger = LoggerFactory.getLogger(RetryingArchiveProvider.class);

  public static class Args extends AlgorithmBase.ArgsBase {
    @Doc(help = "Total number of attempts per request, including the first one.")
    @Optional
    public int maxAttempts = 3;

    @Doc(help = "Pause before the first retry in milliseconds; doubled for every further retry.")
    @Optional
    public long backoffMillis = 1000;
  }

  private final ArchiveProvider delegate;
  private final Args args;

  public RetryingArchiveProvider(ArchiveProvider delegate) {
    this(delegate, new Args());
  }

  public RetryingArchiveProvider(ArchiveProvider delegate, Args args) {
    Preconditions.checkArgument(args.maxAttempts >= 1, "maxAttempts must be at least 1");
    Preconditions.checkArgument(args.backoffMillis >= 0, "backoffMillis must not be negative");
    this.delegate = delegate;
    this.args = args;
  }

  /** @throws IOException the failure of the last attempt when every attempt failed. */
  @Override
  public List<Image> fetch(ArchiveRequest request) throws IOException {
    long pause = args.backoffMillis;
    for (int attempt = 1; ; attempt++) {
      try {
        return delegate.fetch(request);
      } catch (IOException e) {
        if (attempt >= args.maxAttempts) {
          logger.error("Giving up on {} after {} attempts", request, attempt);
          throw e;
        }
        logger.warn("Attempt {} of {} for {} failed: {}", attempt, args.maxAttempts, request,
            e.getMessage());
        Uninterruptibles.sleepUninterruptibly(pause, TimeUnit.MILLISECONDS);
        pause *= 2;
      }
    }
  }
}

/*
 * Copyright (c) 2024 Moataz Abdelnasser
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package io.huginn.testing.junit;

import static java.util.Objects.requireNonNull;

import com.google.common.jimfs.Configuration;
import com.google.common.jimfs.Jimfs;
import io.huginn.testing.Directories;
import java.io.IOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.nio.file.FileSystem;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.extension.AfterEachCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.api.extension.ExtensionContext.Namespace;
import org.junit.jupiter.api.extension.ExtensionContext.Store.CloseableResource;
import org.junit.jupiter.api.extension.ParameterContext;
import org.junit.jupiter.api.extension.ParameterResolutionException;
import org.junit.jupiter.api.extension.ParameterResolver;
import org.junit.platform.commons.support.AnnotationSupport;

/**
 * {@code Extension} that injects a fresh, empty issue root as a {@code Path} parameter. The
 * directory, along with its file system if in-memory, is discarded after the test. If the test
 * fails, the files found under the issue root are logged.
 */
public final class IssueRootExtension implements AfterEachCallback, ParameterResolver {
  private static final Logger logger = System.getLogger(IssueRootExtension.class.getName());
  private static final Namespace EXTENSION_NAMESPACE = Namespace.create(IssueRootExtension.class);
  private static final String TEMP_DIRECTORY_PREFIX = IssueRootExtension.class.getName();

  @IssueRootSpec
  private static final class DefaultSpecHolder {}

  private static final IssueRootSpec DEFAULT_SPEC =
      requireNonNull(DefaultSpecHolder.class.getAnnotation(IssueRootSpec.class));

  public IssueRootExtension() {}

  @Override
  public boolean supportsParameter(
      ParameterContext parameterContext, ExtensionContext extensionContext)
      throws ParameterResolutionException {
    return parameterContext.getParameter().getType() == Path.class;
  }

  @Override
  public Object resolveParameter(
      ParameterContext parameterContext, ExtensionContext extensionContext)
      throws ParameterResolutionException {
    var roots =
        extensionContext
            .getStore(EXTENSION_NAMESPACE)
            .getOrComputeIfAbsent(ManagedRoots.class, __ -> new ManagedRoots(), ManagedRoots.class);
    try {
      return roots.create(findSpec(extensionContext));
    } catch (IOException e) {
      throw new ParameterResolutionException("couldn't create issue root", e);
    }
  }

  @Override
  public void afterEach(ExtensionContext context) {
    if (context.getExecutionException().isEmpty()) {
      return;
    }
    var roots = context.getStore(EXTENSION_NAMESPACE).get(ManagedRoots.class, ManagedRoots.class);
    if (roots != null) {
      roots.logContents();
    }
  }

  private static IssueRootSpec findSpec(ExtensionContext context) {
    return AnnotationSupport.findAnnotation(context.getElement(), IssueRootSpec.class)
        .or(
            () ->
                context
                    .getTestClass()
                    .flatMap(
                        testClass ->
                            AnnotationSupport.findAnnotation(testClass, IssueRootSpec.class)))
        .orElse(DEFAULT_SPEC);
  }

  private static final class ManagedRoots implements CloseableResource {
    private final List<Path> roots = new ArrayList<>();
    private final List<FileSystem> fileSystems = new ArrayList<>();
    private final List<Path> tempDirectories = new ArrayList<>();

    ManagedRoots() {}

    Path create(IssueRootSpec spec) throws IOException {
      Path tempDirectory;
      switch (spec.fileSystem()) {
        case IN_MEMORY:
          var fileSystem = Jimfs.newFileSystem(Configuration.unix());
          fileSystems.add(fileSystem);
          tempDirectory = Files.createDirectories(fileSystem.getPath("/temp"));
          break;
        case SYSTEM:
          tempDirectory =
              Files.createTempDirectory(
                  FileSystems.getDefault().getPath(System.getProperty("java.io.tmpdir")),
                  TEMP_DIRECTORY_PREFIX);
          tempDirectories.add(tempDirectory);
          break;
        default:
          throw new AssertionError();
      }
      var root = Files.createDirectories(tempDirectory.resolve(spec.directoryName()));
      roots.add(root);
      return root;
    }

    void logContents() {
      for (var root : roots) {
        try {
          logger.log(
              Level.INFO,
              "Files under <" + root + ">: " + Directories.listFilesRecursively(root));
        } catch (IOException e) {
          logger.log(Level.WARNING, "Couldn't list files under <" + root + ">", e);
        }
      }
    }

    @Override
    public void close() throws IOException {
      var exceptions = new ArrayList<Exception>();
      for (var directory : tempDirectories) {
        try {
          Directories.deleteRecursively(directory);
        } catch (IOException e) {
          exceptions.add(e);
        }
      }
      for (var fileSystem : fileSystems) {
        try {
          fileSystem.close();
        } catch (IOException e) {
          exceptions.add(e);
        }
      }
      if (!exceptions.isEmpty()) {
        var exception = new IOException("couldn't discard issue roots");
        exceptions.forEach(exception::addSuppressed);
        throw exception;
      }
    }
  }
}

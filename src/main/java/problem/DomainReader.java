/*
 * This file is part of the constraint generation planner CGP.
 *
 * Copyright (c) 2021. All rights reserved.
 * Christophe Lecoutre, CRIL, Univ. Artois and CNRS.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package problem;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import utility.Kit;

/**
 * Loads domain files. A file is named odes_<domain>_<instance>.txt (or solutions_<domain>_<instance>.txt when transitions are provided);
 * it is searched for in the directory translation of the working directory, and then under translation on the classpath.
 */
public final class DomainReader {

	public static final String DIRECTORY = "translation";

	private DomainReader() {
	}

	public static String fileName(String domain, String instance, boolean provideSolutions) {
		return (provideSolutions ? "solutions" : "odes") + "_" + domain + "_" + instance + ".txt";
	}

	/**
	 * Loads the specified domain instance
	 *
	 * @throws DomainException
	 *             if the file cannot be found or read
	 */
	public static Domain read(String domain, String instance, boolean provideSolutions) {
		if (domain == null || instance == null)
			throw new DomainException("A domain and an instance must be given");
		String fileName = fileName(domain, instance, provideSolutions);
		Path path = Paths.get(DIRECTORY, fileName);
		try {
			if (Files.isRegularFile(path)) {
				Kit.log.fine("Reading " + path);
				return Domain.parse(fileName, Files.readString(path, StandardCharsets.UTF_8));
			}
			try (InputStream in = DomainReader.class.getResourceAsStream("/" + DIRECTORY + "/" + fileName)) {
				if (in == null)
					throw new DomainException("Unknown file " + fileName + ", please give a valid domain instance in " + DIRECTORY);
				Kit.log.fine("Reading " + fileName + " from the classpath");
				return Domain.parse(fileName, new String(in.readAllBytes(), StandardCharsets.UTF_8));
			}
		} catch (IOException e) {
			throw new DomainException("Impossible to read " + fileName, e);
		}
	}
}

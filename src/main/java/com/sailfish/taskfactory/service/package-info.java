/**
 * The execution context seam that task wrappers submit work to, and its in-process
 * implementation in {@code service.impl}.
 */
package com.sailfish.taskfactory.service;
